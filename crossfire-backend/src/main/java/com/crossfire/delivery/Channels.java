package com.crossfire.delivery;

import com.crossfire.util.TextSecurity;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Subscriber key naming shared with the push transport.
 */
public final class Channels {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private Channels() {
    }

    /**
     * Group of one client connection of one user: Base64 SHA-256 of {@code <user>_<client>}.
     *
     * @param userSubscriberName user object identifier
     * @param uniqueClientIdentifier client connection identifier
     * @return group identifier
     */
    public static String groupIdentifier(String userSubscriberName, String uniqueClientIdentifier) {
        return TextSecurity.computeHashString(userSubscriberName + "_" + uniqueClientIdentifier);
    }

    /**
     * Channel of a given kind within a group, e.g. {@code QUERY.<group>}.
     */
    public static String channel(String groupIdentifier, ChannelKind kind) {
        return kind.name() + "." + groupIdentifier;
    }

    /**
     * Timestamp text carried by status and heartbeat messages: UTC, {@code yyyy-MM-dd HH:mm:ss}.
     */
    public static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }
}

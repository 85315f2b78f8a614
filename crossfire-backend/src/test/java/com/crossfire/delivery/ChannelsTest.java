package com.crossfire.delivery;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelsTest {

    @Test
    void groupIdentifierHashesUserAndClient() {
        assertThat(Channels.groupIdentifier("user-1", "client-1"))
                .isEqualTo("wbIXOvJOD3tvy9SB24dxrotbskZs3PcH5d31EkxztYU=");
    }

    @Test
    void groupsDifferPerClient() {
        assertThat(Channels.groupIdentifier("user-1", "client-1"))
                .isNotEqualTo(Channels.groupIdentifier("user-1", "client-2"));
    }

    @Test
    void channelIsPrefixedWithKind() {
        assertThat(Channels.channel("abc=", ChannelKind.QUERY)).isEqualTo("QUERY.abc=");
        assertThat(Channels.channel("abc=", ChannelKind.ERROR)).isEqualTo("ERROR.abc=");
        assertThat(Channels.channel("abc=", ChannelKind.HEARTBEAT)).isEqualTo("HEARTBEAT.abc=");
    }

    @Test
    void timestampIsUtcWithSecondPrecision() {
        assertThat(Channels.timestamp(Instant.parse("2024-03-01T10:00:05.750Z"))).isEqualTo("2024-03-01 10:00:05");
    }
}

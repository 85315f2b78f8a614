package com.crossfire.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current health of a model server, pushed on the heartbeat channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatMessage {
    /** UTC, formatted {@code yyyy-MM-dd HH:mm:ss}. */
    private String timestamp;
    /** Qualified server name, see {@code QueryRequest#getServerQualifiedName()}. */
    private String server;
    /** One of the {@link ModelServerState} values. */
    private String heartbeatState;
    /** Hash of the server launch settings, empty when unknown. */
    private String serverHash;
}

package com.crossfire.delivery;

/**
 * Health states reported for a model server in heartbeat messages.
 */
public final class ModelServerState {
    public static final String ONLINE = "Succeeded";
    public static final String OFFLINE = "Paused";
    public static final String UPDATING = "Updating";

    private ModelServerState() {
    }
}

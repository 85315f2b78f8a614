package com.crossfire.delivery;

/**
 * Delivery channels a subscriber can join, with the client method each one invokes.
 */
public enum ChannelKind {
    HEARTBEAT("heartBeat"),
    QUERY("queryResult"),
    METADATA("modelMetadata"),
    ERROR("errorMessage"),
    STATUS("jobStatus");

    private final String clientMethod;

    ChannelKind(String clientMethod) {
        this.clientMethod = clientMethod;
    }

    public String getClientMethod() {
        return clientMethod;
    }
}

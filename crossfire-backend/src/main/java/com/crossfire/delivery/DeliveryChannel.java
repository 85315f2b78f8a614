package com.crossfire.delivery;

/**
 * Push transport towards subscribed clients. Transport and group membership are not visible here.
 */
public interface DeliveryChannel {

    /**
     * Pushes a payload to a subscriber.
     *
     * @param subscriberKey channel name, see {@link Channels#channel(String, ChannelKind)}
     * @param kind channel kind
     * @param payload message object
     */
    void send(String subscriberKey, ChannelKind kind, Object payload);
}

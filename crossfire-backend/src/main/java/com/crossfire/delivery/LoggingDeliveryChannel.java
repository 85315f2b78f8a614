package com.crossfire.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link DeliveryChannel} that writes each message to the log. Used when no push transport is wired.
 */
@Slf4j
public class LoggingDeliveryChannel implements DeliveryChannel {
    private final ObjectMapper objectMapper;

    public LoggingDeliveryChannel(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(String subscriberKey, ChannelKind kind, Object payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            body = String.valueOf(payload);
        }
        log.info("Delivery: subscriber={}, method={}, payload={}", subscriberKey, kind.getClientMethod(), body);
    }
}

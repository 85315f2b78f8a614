package com.crossfire.service;

import com.crossfire.cache.CacheEntry;
import com.crossfire.cache.FingerprintCache;
import com.crossfire.delivery.DeliveryChannel;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;

import java.time.Clock;

/**
 * Optional capabilities of a background job. Anything left unset is simply not used: without a
 * cache every request executes, without a delivery channel results are only logged.
 *
 * @param <T> cached value type
 */
@Value
@Builder
public class JobOptions<T> {
    FingerprintCache<T> cache;
    DeliveryChannel deliveryChannel;
    Logger logger;
    /** Session id this instance writes cache records under. */
    @Builder.Default
    String cacheSessionId = "local";
    @Builder.Default
    int cacheTtlSeconds = CacheEntry.DEFAULT_TTL_SECONDS;
    /** Time source for message timestamps. */
    @Builder.Default
    Clock clock = Clock.systemUTC();
}

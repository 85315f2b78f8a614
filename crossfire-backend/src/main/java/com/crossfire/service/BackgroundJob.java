package com.crossfire.service;

import com.crossfire.cache.CacheEntry;
import com.crossfire.cache.CacheStorageException;
import com.crossfire.cache.CacheValueCodecException;
import com.crossfire.cache.FingerprintCache;
import com.crossfire.delivery.ChannelKind;
import com.crossfire.delivery.Channels;
import com.crossfire.delivery.DeliveryChannel;
import com.crossfire.delivery.ErrorMessage;
import com.crossfire.delivery.HeartbeatMessage;
import com.crossfire.delivery.ModelServerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Base class for work executed on a job queue.
 *
 * <p>A job never throws to its submitter: results and failures both travel back to the client over
 * the delivery channel.
 *
 * @param <R> request type
 * @param <T> cached value type
 */
public abstract class BackgroundJob<R, T> {
    protected final Logger log;

    private final FingerprintCache<T> cache;
    private final DeliveryChannel deliveryChannel;
    private final String cacheSessionId;
    private final int cacheTtlSeconds;
    private final Clock clock;

    protected BackgroundJob(JobOptions<T> options) {
        this.log = options.getLogger() != null ? options.getLogger() : LoggerFactory.getLogger(getClass());
        this.cache = options.getCache();
        this.deliveryChannel = options.getDeliveryChannel();
        this.cacheSessionId = options.getCacheSessionId();
        this.cacheTtlSeconds = options.getCacheTtlSeconds();
        this.clock = options.getClock();
    }

    /**
     * Processes a request and delivers the outcome.
     *
     * @param request job input
     * @param jobParams identity the job acts for
     */
    public abstract void process(R request, BackgroundJobParams jobParams);

    /**
     * Looks up a cached value. A storage failure or an undecodable record is logged and treated as
     * a miss.
     */
    protected Optional<T> cached(String cacheKey) {
        if (cache == null) {
            return Optional.empty();
        }
        try {
            return cache.get(cacheKey).map(CacheEntry::getValue);
        } catch (CacheStorageException | CacheValueCodecException e) {
            log.warn("Cache read failed, continuing uncached: cache_key={}", cacheKey, e);
            return Optional.empty();
        }
    }

    /**
     * Stores a value under this instance's session id. A storage failure is logged and ignored.
     */
    protected void store(String cacheKey, T value) {
        if (cache == null) {
            return;
        }
        try {
            cache.set(cacheKey, cacheSessionId, value, cacheTtlSeconds);
        } catch (CacheStorageException | CacheValueCodecException e) {
            log.warn("Cache write failed: cache_key={}", cacheKey, e);
        }
    }

    protected void deliver(String userSubscriberName, String uniqueClientIdentifier, ChannelKind kind, Object message) {
        String channel = Channels.channel(Channels.groupIdentifier(userSubscriberName, uniqueClientIdentifier), kind);
        if (deliveryChannel == null) {
            log.info("No delivery channel configured, dropping message: channel={}", channel);
            return;
        }
        deliveryChannel.send(channel, kind, message);
    }

    protected void sendError(String errorMessage, String userSubscriberName, String uniqueClientIdentifier, Object request) {
        ErrorMessage message = ErrorMessage.builder()
                .payload(errorMessage)
                .userSubscriberName(userSubscriberName)
                .submittedRequest(request)
                .build();
        deliver(userSubscriberName, uniqueClientIdentifier, ChannelKind.ERROR, message);
    }

    protected void sendHeartbeat(String serverQualifiedName, String heartbeatState, String serverHash, String userSubscriberName, String uniqueClientIdentifier) {
        HeartbeatMessage message = HeartbeatMessage.builder()
                .timestamp(Channels.timestamp(clock.instant()))
                .server(serverQualifiedName)
                .heartbeatState(heartbeatState)
                .serverHash(serverHash)
                .build();
        deliver(userSubscriberName, uniqueClientIdentifier, ChannelKind.HEARTBEAT, message);
    }

    /**
     * Reports a failed job to the client. An unreachable model server is additionally reported as
     * offline on the heartbeat channel.
     */
    protected void sendFailure(Exception e, String serverQualifiedName, String userSubscriberName, String uniqueClientIdentifier, Object request) {
        sendError(e.getMessage(), userSubscriberName, uniqueClientIdentifier, request);
        if (e instanceof ModelServerConnectionException) {
            log.warn("Model server offline: server={}", serverQualifiedName);
            sendHeartbeat(serverQualifiedName, ModelServerState.OFFLINE, "", userSubscriberName, uniqueClientIdentifier);
        }
    }
}

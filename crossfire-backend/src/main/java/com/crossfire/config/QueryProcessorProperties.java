package com.crossfire.config;

import com.crossfire.cache.CacheEntry;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Worker and result cache settings of this host.
 */
@Data
@ConfigurationProperties(prefix = "crossfire.query-processor")
public class QueryProcessorProperties {
    /** Worker threads on this host; half as many queues are created, at least one. */
    private int workers = 4;
    /** Host name used in queue names and as the cache session id. Defaults to the local host name. */
    private String hostName;
    private int cacheTtlSeconds = CacheEntry.DEFAULT_TTL_SECONDS;
    /** How long a finished job can still be requeued. */
    private int jobRetentionSeconds = 600;

    public String resolveHostName() {
        if (hostName != null && !hostName.isBlank()) {
            return hostName;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Cannot resolve local host name; set crossfire.query-processor.host-name", e);
        }
    }
}

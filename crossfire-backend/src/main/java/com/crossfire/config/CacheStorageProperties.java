package com.crossfire.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backing store of the distributed cache.
 */
@Data
@ConfigurationProperties(prefix = "crossfire.cache")
public class CacheStorageProperties {
    /** {@code memory} or {@code jdbc}. */
    private String storage = "memory";
    private String jdbcUrl;
    private String username;
    private String password;
    private String tableName = "query_cache";
    private int maxPoolSize = 5;
}

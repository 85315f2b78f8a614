package com.crossfire.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection to the model server queries are executed on.
 */
@Data
@ConfigurationProperties(prefix = "crossfire.executor")
public class ExecutorProperties {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maxPoolSize = 5;
}

package com.crossfire.config;

import com.crossfire.cache.CacheStorage;
import com.crossfire.cache.FingerprintCache;
import com.crossfire.cache.InMemoryCacheStorage;
import com.crossfire.cache.JdbcCacheStorage;
import com.crossfire.cache.JsonCacheValueCodec;
import com.crossfire.cache.StringCacheValueCodec;
import com.crossfire.delivery.DeliveryChannel;
import com.crossfire.delivery.LoggingDeliveryChannel;
import com.crossfire.dispatch.JobQueue;
import com.crossfire.dispatch.LocalJobQueue;
import com.crossfire.dispatch.ShardAssigner;
import com.crossfire.materializer.ResultMaterializer;
import com.crossfire.materializer.TabularCursor;
import com.crossfire.metadata.MetadataSource;
import com.crossfire.metadata.ModelMetadata;
import com.crossfire.query.QueryCompiler;
import com.crossfire.service.JdbcQueryExecutor;
import com.crossfire.service.JobOptions;
import com.crossfire.service.MetadataJob;
import com.crossfire.service.QueryExecutionException;
import com.crossfire.service.QueryExecutor;
import com.crossfire.service.QueryJob;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.function.Function;

/**
 * Wires the query pipeline. External collaborators (delivery transport, execution backend, metadata
 * source) fall back to local implementations when the application does not provide its own.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({QueryProcessorProperties.class, CacheStorageProperties.class, ExecutorProperties.class})
public class CrossfireConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ShardAssigner shardAssigner() {
        return new ShardAssigner(new Random());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueue jobQueue(QueryProcessorProperties properties, Clock clock) {
        return new LocalJobQueue(Duration.ofSeconds(properties.getJobRetentionSeconds()), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryChannel deliveryChannel(ObjectMapper objectMapper) {
        return new LoggingDeliveryChannel(objectMapper);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "crossfire.cache", name = "storage", havingValue = "jdbc")
    public HikariDataSource cacheDataSource(CacheStorageProperties properties) {
        if (properties.getJdbcUrl() == null || properties.getJdbcUrl().isBlank()) {
            throw new IllegalArgumentException("crossfire.cache.jdbc-url is required for jdbc cache storage");
        }
        return new HikariDataSource(buildHikariConfig(
                "Pool-cache", properties.getJdbcUrl(), properties.getUsername(), properties.getPassword(), properties.getMaxPoolSize()));
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheStorage cacheStorage(
            CacheStorageProperties properties,
            @Qualifier("cacheDataSource") ObjectProvider<HikariDataSource> cacheDataSource
    ) {
        HikariDataSource ds = cacheDataSource.getIfAvailable();
        if (ds == null) {
            log.info("Using in-memory cache storage");
            return new InMemoryCacheStorage();
        }
        JdbcCacheStorage storage = new JdbcCacheStorage(ds, properties.getTableName());
        storage.createTable();
        return storage;
    }

    @Bean
    public FingerprintCache<String> resultCache(CacheStorage cacheStorage, Clock clock) {
        return new FingerprintCache<>(cacheStorage, new StringCacheValueCodec(), clock);
    }

    @Bean
    public FingerprintCache<ModelMetadata> metadataCache(CacheStorage cacheStorage, ObjectMapper objectMapper, Clock clock) {
        return new FingerprintCache<>(cacheStorage, new JsonCacheValueCodec<>(objectMapper, ModelMetadata.class), clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "crossfire.executor", name = "jdbc-url")
    public HikariDataSource executorDataSource(ExecutorProperties properties) {
        return new HikariDataSource(buildHikariConfig(
                "Pool-executor", properties.getJdbcUrl(), properties.getUsername(), properties.getPassword(), properties.getMaxPoolSize()));
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryExecutor queryExecutor(@Qualifier("executorDataSource") ObjectProvider<HikariDataSource> executorDataSource) {
        HikariDataSource ds = executorDataSource.getIfAvailable();
        if (ds == null) {
            log.warn("crossfire.executor.jdbc-url is not set; queries will fail until an execution backend is configured");
            return new QueryExecutor() {
                @Override
                public <R> R execute(String queryText, Function<TabularCursor, R> handler) {
                    throw new QueryExecutionException("No execution backend configured", null);
                }
            };
        }
        return new JdbcQueryExecutor(ds);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataSource metadataSource() {
        return request -> {
            throw new UnsupportedOperationException("No metadata source configured for database: " + request.getTargetDatabase());
        };
    }

    @Bean
    public QueryJob queryJob(
            QueryCompiler compiler,
            QueryExecutor executor,
            ResultMaterializer materializer,
            FingerprintCache<String> resultCache,
            DeliveryChannel deliveryChannel,
            Clock clock,
            QueryProcessorProperties properties
    ) {
        JobOptions<String> options = JobOptions.<String>builder()
                .cache(resultCache)
                .deliveryChannel(deliveryChannel)
                .clock(clock)
                .cacheSessionId(properties.resolveHostName())
                .cacheTtlSeconds(properties.getCacheTtlSeconds())
                .build();
        return new QueryJob(compiler, executor, materializer, options);
    }

    @Bean
    public MetadataJob metadataJob(
            MetadataSource metadataSource,
            ObjectMapper objectMapper,
            Clock clock,
            FingerprintCache<ModelMetadata> metadataCache,
            DeliveryChannel deliveryChannel,
            QueryProcessorProperties properties
    ) {
        JobOptions<ModelMetadata> options = JobOptions.<ModelMetadata>builder()
                .cache(metadataCache)
                .deliveryChannel(deliveryChannel)
                .clock(clock)
                .cacheSessionId(properties.resolveHostName())
                .cacheTtlSeconds(MetadataJob.METADATA_TTL_SECONDS)
                .build();
        return new MetadataJob(metadataSource, objectMapper, clock, options);
    }

    private static HikariConfig buildHikariConfig(String poolName, String jdbcUrl, String username, String password, int maximumPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(1);
        return config;
    }
}

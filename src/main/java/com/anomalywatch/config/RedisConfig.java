package com.anomalywatch.config;

import com.anomalywatch.model.InvestigatorType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.Map;

/**
 * Redis cache configuration.
 *
 * CACHE REGIONS:
 * ==============
 * - investigatorTypes: InvestigatorType catalog entries by code (TTL: 1 hour).
 *   The catalog is seeded at startup and practically never changes.
 *
 * Execution counters and results are never cached: they change on every saved
 * finding and the counter must always be read from the database.
 *
 * Setting spring.cache.type to anything other than redis (tests use "none")
 * leaves cache manager selection to Spring Boot.
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisConfig {

    public static final String INVESTIGATOR_TYPES_CACHE = "investigatorTypes";

    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        // Kept private so the web layer's ObjectMapper is left untouched
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(30))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        RedisCacheConfiguration typeCacheConfig = defaultConfig
            .entryTtl(Duration.ofHours(1))
            .prefixCacheNameWith("aw:")
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new Jackson2JsonRedisSerializer<>(mapper, InvestigatorType.class)));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(Map.of(INVESTIGATOR_TYPES_CACHE, typeCacheConfig))
            .transactionAware()
            .build();

        log.info("Configured RedisCacheManager with regions: {} (1h)", INVESTIGATOR_TYPES_CACHE);
        return cacheManager;
    }
}

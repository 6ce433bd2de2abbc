package com.remediation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.remediation.domain.model.RateLimitWindow;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for rate limit windows.
 *
 * <p>Values are serialized with the application's Jackson {@link ObjectMapper}, which already
 * carries JSR-310 support for the {@code Instant} fields.
 *
 * <p>All keys are prefixed with "remediation:" because the Redis server may be shared.
 *
 * <p>Key schema:
 * <pre>
 *   remediation:ratelimit:runbook:{runbookId}  → RateLimitWindow JSON (TTL = window length)
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "remediation:";

    public static final String KEY_PREFIX_RATE_LIMIT = KEY_PREFIX + "ratelimit:runbook:";

    @Bean
    public RedisTemplate<String, RateLimitWindow> rateLimitWindowRedisTemplate(
            RedisConnectionFactory redisConnectionFactory, ObjectMapper objectMapper) {
        RedisTemplate<String, RateLimitWindow> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<RateLimitWindow> jsonRedisSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, RateLimitWindow.class);

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}

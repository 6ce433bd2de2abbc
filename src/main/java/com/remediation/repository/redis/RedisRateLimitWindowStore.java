package com.remediation.repository.redis;

import com.remediation.config.RedisConfig;
import com.remediation.domain.model.RateLimitWindow;
import com.remediation.exception.StateReadException;
import com.remediation.ratelimit.RateLimitWindowStore;
import java.time.Duration;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

/**
 * Redis-backed storage for per-runbook rate limit windows.
 *
 * <p>Each window is stored under {@code remediation:ratelimit:runbook:{runbookId}} and expires with
 * the window itself, so an idle runbook leaves nothing behind. Redis or serialization failures
 * surface as {@link StateReadException}.
 */
@Component
public class RedisRateLimitWindowStore implements RateLimitWindowStore {

    private final RedisTemplate<String, RateLimitWindow> redisTemplate;

    public RedisRateLimitWindowStore(RedisTemplate<String, RateLimitWindow> rateLimitWindowRedisTemplate) {
        this.redisTemplate = rateLimitWindowRedisTemplate;
    }

    @Override
    public Optional<RateLimitWindow> load(Long runbookId) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key(runbookId)));
        } catch (DataAccessException | SerializationException e) {
            throw new StateReadException("Failed to load rate limit window for runbook " + runbookId, e);
        }
    }

    @Override
    public void save(RateLimitWindow window) {
        try {
            redisTemplate
                    .opsForValue()
                    .set(key(window.getRunbookId()), window, Duration.ofSeconds(Math.max(1, window.getWindowSeconds())));
        } catch (DataAccessException | SerializationException e) {
            throw new StateReadException("Failed to save rate limit window for runbook " + window.getRunbookId(), e);
        }
    }

    private String key(Long runbookId) {
        return RedisConfig.KEY_PREFIX_RATE_LIMIT + runbookId;
    }
}

package com.remediation.ratelimit;

import com.remediation.domain.enums.RateLimitDecision;
import com.remediation.domain.model.RateLimitPolicy;
import com.remediation.domain.model.RateLimitWindow;
import com.remediation.domain.model.Runbook;
import com.remediation.exception.StateReadException;
import com.remediation.exception.TriggerConfigurationException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Fixed-window execution limit per runbook.
 *
 * <p>The check and the increment happen under one per-runbook monitor, so the number of
 * admissions inside a window never exceeds the limit even when alerts arrive concurrently.
 * A window ends at {@code windowStart + windowSeconds}; the first admission after that starts a
 * new window at the current instant.
 *
 * <p>Runbooks without a policy fall back to {@link RateLimiterConfig}. Unlimited policies never
 * touch the window store.
 */
@Service
@EnableConfigurationProperties(RateLimiterConfig.class)
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final RateLimitWindowStore windowStore;
    private final RateLimiterConfig config;
    private final Clock clock;

    private final ConcurrentMap<Long, Object> runbookLocks = new ConcurrentHashMap<>();

    public RateLimiterService(RateLimitWindowStore windowStore, RateLimiterConfig config, Clock clock) {
        this.windowStore = windowStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Counts one execution of the runbook against its current window if there is room.
     *
     * @throws StateReadException when the window store fails and fail-open is not configured
     * @throws TriggerConfigurationException when a limited policy has no positive window
     */
    public RateLimitDecision admit(Runbook runbook) {
        RateLimitPolicy policy = validPolicy(runbook);
        if (policy.isUnlimited()) {
            return RateLimitDecision.ALLOW;
        }

        Long runbookId = runbook.getId();
        synchronized (runbookLocks.computeIfAbsent(runbookId, k -> new Object())) {
            try {
                return checkAndIncrement(runbookId, policy);
            } catch (StateReadException e) {
                if (config.isFailOpenOnStateError()) {
                    log.warn("Rate window for runbook {} unavailable, admitting (fail-open): {}", runbookId, e.getMessage());
                    return RateLimitDecision.ALLOW;
                }
                log.error("Rate window for runbook {} unavailable, denying", runbookId, e);
                throw e;
            }
        }
    }

    /**
     * Current usage of the runbook's window, without counting anything.
     *
     * @return the live window, or a zero-count window starting now when none is open; empty for
     *     unlimited runbooks
     * @throws StateReadException when the window store fails
     * @throws TriggerConfigurationException when a limited policy has no positive window
     */
    public Optional<RateLimitWindow> getUsage(Runbook runbook) {
        RateLimitPolicy policy = validPolicy(runbook);
        if (policy.isUnlimited()) {
            return Optional.empty();
        }
        return Optional.of(currentWindow(runbook.getId(), policy, clock.instant()));
    }

    private RateLimitDecision checkAndIncrement(Long runbookId, RateLimitPolicy policy) {
        RateLimitWindow window = currentWindow(runbookId, policy, clock.instant());

        if (window.getCount() >= policy.getMaxExecutions()) {
            log.info(
                    "Runbook {} rate limited: {}/{} in window ending {}",
                    runbookId,
                    window.getCount(),
                    policy.getMaxExecutions(),
                    window.getWindowEnd());
            return RateLimitDecision.DENY;
        }

        window.setCount(window.getCount() + 1);
        window.setLimit(policy.getMaxExecutions());
        windowStore.save(window);
        log.debug("Runbook {} admitted: {}/{} in current window", runbookId, window.getCount(), policy.getMaxExecutions());
        return RateLimitDecision.ALLOW;
    }

    private RateLimitWindow currentWindow(Long runbookId, RateLimitPolicy policy, Instant now) {
        return windowStore
                .load(runbookId)
                .filter(w -> w.getWindowSeconds() == policy.getWindowSeconds() && !w.isExpired(now))
                .orElseGet(() -> RateLimitWindow.builder()
                        .runbookId(runbookId)
                        .windowStart(now)
                        .count(0)
                        .limit(policy.getMaxExecutions())
                        .windowSeconds(policy.getWindowSeconds())
                        .build());
    }

    private RateLimitPolicy validPolicy(Runbook runbook) {
        RateLimitPolicy policy = resolvePolicy(runbook);
        if (!policy.hasValidWindow()) {
            throw TriggerConfigurationException.forRunbook(
                    runbook.getId(),
                    "Rate limit of runbook " + runbook.getId() + " allows " + policy.getMaxExecutions()
                            + " executions per " + policy.getWindowSeconds() + "s window; the window must be positive");
        }
        return policy;
    }

    RateLimitPolicy resolvePolicy(Runbook runbook) {
        if (runbook.getRateLimit() != null) {
            return runbook.getRateLimit();
        }
        return RateLimitPolicy.builder()
                .maxExecutions(config.getDefaultMaxExecutions())
                .windowSeconds(config.getDefaultWindow().toSeconds())
                .build();
    }
}

package com.remediation.ratelimit;

import com.remediation.domain.model.RateLimitWindow;
import java.util.Optional;

/**
 * Storage for per-runbook rate windows. Raises
 * {@link com.remediation.exception.StateReadException} when the backing store is unavailable.
 */
public interface RateLimitWindowStore {

    Optional<RateLimitWindow> load(Long runbookId);

    void save(RateLimitWindow window);
}

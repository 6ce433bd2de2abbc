package com.remediation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Maximum executions of a runbook per fixed window. {@code maxExecutions <= 0} means unlimited; a
 * limited policy needs a positive {@code windowSeconds}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitPolicy {

    private int maxExecutions;
    private long windowSeconds;

    public boolean isUnlimited() {
        return maxExecutions <= 0;
    }

    public boolean hasValidWindow() {
        return isUnlimited() || windowSeconds > 0;
    }
}

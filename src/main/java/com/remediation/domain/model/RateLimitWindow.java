package com.remediation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed-window execution counter for one runbook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitWindow {

    private Long runbookId;
    private Instant windowStart;
    private int count;
    private int limit;
    private long windowSeconds;

    @JsonIgnore
    public Instant getWindowEnd() {
        return windowStart.plusSeconds(windowSeconds);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(getWindowEnd());
    }
}

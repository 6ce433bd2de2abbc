package com.remediation.ratelimit;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Fallback rate limit for runbooks that declare none, under {@code remediation.rate-limit}.
 * {@code defaultMaxExecutions = 0} leaves such runbooks unlimited.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "remediation.rate-limit")
public class RateLimiterConfig {

    @Min(0)
    private int defaultMaxExecutions = 0;

    @NotNull
    private Duration defaultWindow = Duration.ofHours(1);

    private boolean failOpenOnStateError = false;
}

package com.remediation.circuit;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Circuit breaker policy under the {@code remediation.circuit-breaker} prefix.
 *
 * <ul>
 *   <li>{@code failureThreshold} -- consecutive failed outcomes that open a CLOSED breaker</li>
 *   <li>{@code openDuration} -- how long the first trip keeps the breaker OPEN</li>
 *   <li>{@code backoffMultiplier} -- growth of the open period for each failed probe</li>
 *   <li>{@code maxOpenDuration} -- cap on the open period</li>
 *   <li>{@code probeTimeout} -- a HALF_OPEN probe with no outcome after this long is considered lost</li>
 *   <li>{@code failOpenOnStateError} -- admit when state cannot be read (off: deny)</li>
 *   <li>{@code idempotencyWindow} -- recorded execution ids remembered per scope to ignore replays</li>
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "remediation.circuit-breaker")
public class CircuitBreakerConfig {

    @Min(1)
    private int failureThreshold = 3;

    @NotNull
    private Duration openDuration = Duration.ofMinutes(30);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @NotNull
    private Duration maxOpenDuration = Duration.ofHours(4);

    @NotNull
    private Duration probeTimeout = Duration.ofMinutes(30);

    private boolean failOpenOnStateError = false;

    @Min(1)
    private int idempotencyWindow = 100;
}

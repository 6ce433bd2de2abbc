package com.remediation.orchestration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Dispatch and lifecycle settings under {@code remediation.execution}.
 *
 * <p>{@code approvalExpiryCheckMs} and {@code staleCheckMs} drive the scheduled sweeps and are
 * read through property placeholders on the {@code @Scheduled} methods.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "remediation.execution")
public class ExecutionConfig {

    @Min(1)
    private int workerCount = 4;

    @NotNull
    private Duration defaultActionTimeout = Duration.ofMinutes(5);

    /** RUNNING executions started longer ago than this are failed as TIMED_OUT. */
    @NotNull
    private Duration staleRunningThreshold = Duration.ofMinutes(30);

    /** Added to a runbook's own timeout before its RUNNING execution counts as stale. */
    @NotNull
    private Duration staleTimeoutMargin = Duration.ofMinutes(5);

    @NotNull
    private Duration approvalTtl = Duration.ofHours(4);

    private boolean processResolvedAlerts = false;

    @Min(1000)
    private long approvalExpiryCheckMs = 60_000;

    @Min(1000)
    private long staleCheckMs = 300_000;

    /** Scope type used when a runbook does not declare one. */
    @NotNull
    private String defaultScopeType = "host";
}

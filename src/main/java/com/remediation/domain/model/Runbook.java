package com.remediation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pre-authored remediation procedure together with its execution policy.
 *
 * <p>The action definition is opaque to the core and handed unchanged to the
 * {@link com.remediation.runner.ActionRunner}. If {@code approvalRequired} is set,
 * {@code autoExecute} is ignored for gating.
 *
 * <p>Executions keep a JSON copy of the runbook taken at creation time, so later edits
 * never rewrite history.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Runbook {

    private Long id;
    private String name;

    @Builder.Default
    private boolean enabled = true;

    /** Scope type the runbook acts on ("host", "service", ...). Circuit breakers are keyed by it. */
    private String targetScopeType;

    private boolean autoExecute;
    private boolean approvalRequired;

    /** Null means the configured default policy applies. */
    private RateLimitPolicy rateLimit;

    private String actionDefinition;

    /** Null means the configured default action timeout applies. */
    private Integer timeoutSeconds;
}

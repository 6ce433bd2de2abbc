package com.remediation.domain.model;

import com.remediation.domain.enums.AlertSeverity;
import com.remediation.domain.enums.AlertStatus;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An alert delivered by the monitoring boundary, already parsed.
 *
 * <p>Immutable: one instance per webhook delivery. Executions reference it by {@code id}
 * and copy the fields they need, so the alert itself is never stored or mutated by the core.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    String id;
    String name;
    AlertSeverity severity;

    /** Target the alert is about (host, service, ...). Combined with the runbook's scope type. */
    String scope;

    @Builder.Default
    AlertStatus status = AlertStatus.FIRING;

    @Singular
    Map<String, String> labels;

    /** Monitoring source that emitted the alert (e.g. "prometheus"). Informational only. */
    String source;

    Instant receivedAt;
}

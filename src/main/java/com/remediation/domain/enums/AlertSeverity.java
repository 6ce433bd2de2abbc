package com.remediation.domain.enums;

import java.util.Locale;

/**
 * Severity reported by the monitoring source for an alert.
 *
 * <p>Sources send severities in mixed case ("critical", "Warning"), so parsing
 * is case-insensitive via {@link #fromValue(String)}.
 */
public enum AlertSeverity {

    /** Informational, usually not worth automated action. */
    INFO,

    /** Degraded but serving. */
    WARNING,

    /** Outage or imminent outage. */
    CRITICAL;

    /**
     * Parses a severity string ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the value is null or not a known severity
     */
    public static AlertSeverity fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Alert severity must not be null");
        }
        return AlertSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

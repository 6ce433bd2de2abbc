package com.remediation.domain.enums;

/**
 * Which executions a blackout window suppresses.
 */
public enum BlackoutScope {

    /** Every candidate, including those waiting for approval. */
    ALL,

    /** Only candidates that would be dispatched without approval. */
    AUTO_ONLY,

    /** Only the runbooks listed on the window. */
    SPECIFIC_RUNBOOKS
}

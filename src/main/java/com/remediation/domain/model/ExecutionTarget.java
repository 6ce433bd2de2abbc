package com.remediation.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * What the action runner acts on. Connection details are resolved by the runner itself
 * from its own credential store; the core only passes identifiers.
 */
@Value
@Builder
public class ExecutionTarget {

    String executionId;
    String scopeType;
    String scopeId;
    Map<String, String> variables;
}

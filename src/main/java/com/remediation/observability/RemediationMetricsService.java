package com.remediation.observability;

import com.remediation.domain.model.Execution;
import com.remediation.event.CircuitBreakerEvent;
import com.remediation.event.ExecutionEvent;
import com.remediation.event.ExecutionEventType;
import com.remediation.event.TriggerConfigurationEvent;
import com.remediation.orchestration.ExecutionQueue;
import com.remediation.orchestration.ExecutionWorkerPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the remediation core.
 * <ul>
 *   <li><b>remediation.executions</b> (counter, tag status): every execution entering a status</li>
 *   <li><b>remediation.execution.duration</b> (timer, tag outcome): RUNNING to terminal</li>
 *   <li><b>remediation.circuit.transitions</b> (counter, tag state): breaker transitions by target state</li>
 *   <li><b>remediation.trigger.config.errors</b> (counter): broken trigger definitions hit while matching</li>
 *   <li><b>remediation.queue.depth</b> (gauge): executions waiting for a worker</li>
 *   <li><b>remediation.actions.inflight</b> (gauge): actions currently running</li>
 * </ul>
 */
@Service
public class RemediationMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter configErrorCounter;

    public RemediationMetricsService(
            MeterRegistry meterRegistry, ExecutionQueue executionQueue, ExecutionWorkerPool executionWorkerPool) {
        this.meterRegistry = meterRegistry;

        this.configErrorCounter = Counter.builder("remediation.trigger.config.errors")
                .description("Trigger definitions skipped because they could not be evaluated")
                .register(meterRegistry);

        meterRegistry.gauge("remediation.queue.depth", executionQueue, ExecutionQueue::size);
        meterRegistry.gauge(
                "remediation.actions.inflight", executionWorkerPool, ExecutionWorkerPool::inFlightCount);
    }

    @EventListener
    @Order(20)
    public void onExecutionEvent(ExecutionEvent event) {
        Execution execution = event.getExecution();
        meterRegistry
                .counter("remediation.executions", "status", execution.getStatus().name())
                .increment();

        boolean finishedRun = event.getEventType() == ExecutionEventType.COMPLETED
                || (event.getEventType() == ExecutionEventType.CANCELLED && execution.getOutcome() != null);
        if (finishedRun && execution.getStartedAt() != null && execution.getCompletedAt() != null) {
            Timer.builder("remediation.execution.duration")
                    .description("Time from action start to outcome")
                    .tag("outcome", execution.getOutcome().name())
                    .register(meterRegistry)
                    .record(Duration.between(execution.getStartedAt(), execution.getCompletedAt()));
        }
    }

    @EventListener
    @Order(20)
    public void onCircuitBreakerEvent(CircuitBreakerEvent event) {
        meterRegistry
                .counter("remediation.circuit.transitions", "state", event.getCurrentState().name())
                .increment();
    }

    @EventListener
    @Order(20)
    public void onTriggerConfigurationEvent(TriggerConfigurationEvent event) {
        configErrorCounter.increment();
    }
}

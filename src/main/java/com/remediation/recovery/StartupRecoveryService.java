package com.remediation.recovery;

import com.remediation.orchestration.ExecutionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Brings execution history back in line with reality after a restart, then keeps it there.
 *
 * <p>On startup:
 * <ol>
 *   <li>RUNNING executions older than the stale threshold are failed as TIMED_OUT</li>
 *   <li>PENDING executions are queued again</li>
 *   <li>approvals past their expiry are skipped</li>
 * </ol>
 *
 * <p>The stale sweep and the approval expiry also run on a fixed delay.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final ExecutionOrchestrator executionOrchestrator;

    public StartupRecoveryService(ExecutionOrchestrator executionOrchestrator) {
        this.executionOrchestrator = executionOrchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting execution recovery...");

        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            recoveryResult.setStaleExecutionsFailed(executionOrchestrator.reconcileStaleExecutions());
            recoveryResult.setPendingExecutionsRequeued(executionOrchestrator.requeuePendingExecutions());
            recoveryResult.setApprovalsExpired(executionOrchestrator.expireStaleApprovals());
            recoveryResult.setSuccess(true);
        } catch (Exception e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("Execution recovery failed", e);
        }

        recoveryResult.setDurationMs(System.currentTimeMillis() - recoveryResult.getStartedAt());
        log.info(
                "Execution recovery {}: duration={}ms, staleFailed={}, pendingRequeued={}, approvalsExpired={}",
                recoveryResult.isSuccess() ? "completed" : "failed",
                recoveryResult.getDurationMs(),
                recoveryResult.getStaleExecutionsFailed(),
                recoveryResult.getPendingExecutionsRequeued(),
                recoveryResult.getApprovalsExpired());
        return recoveryResult;
    }

    @Scheduled(
            fixedDelayString = "${remediation.execution.stale-check-ms:300000}",
            initialDelayString = "${remediation.execution.stale-check-ms:300000}")
    public void sweepStaleExecutions() {
        try {
            executionOrchestrator.reconcileStaleExecutions();
        } catch (RuntimeException e) {
            log.error("Stale execution sweep failed", e);
        }
    }

    @Scheduled(
            fixedDelayString = "${remediation.execution.approval-expiry-check-ms:60000}",
            initialDelayString = "${remediation.execution.approval-expiry-check-ms:60000}")
    public void sweepExpiredApprovals() {
        try {
            executionOrchestrator.expireStaleApprovals();
        } catch (RuntimeException e) {
            log.error("Approval expiry sweep failed", e);
        }
    }
}

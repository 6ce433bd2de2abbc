package com.remediation.orchestration;

import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.model.ActionResult;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.ExecutionTarget;
import com.remediation.domain.model.Runbook;
import com.remediation.exception.ActionTransportException;
import com.remediation.runner.ActionRunner;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Consumer threads draining the {@link ExecutionQueue} and running actions.
 *
 * <p>Each worker blocks on {@code ExecutionQueue.take()}, moves the execution to RUNNING and hands
 * the action to the {@code actionRunnerExecutor}. The call is bounded by a Resilience4j
 * {@link TimeLimiter} using the runbook timeout (or the configured default), and the running future
 * is tracked so an operator cancel can interrupt it. Whatever happens, the execution is completed
 * exactly once with an outcome; nothing is retried.
 *
 * <p>Outcome mapping:
 * <ul>
 *   <li>runner reports success: SUCCEEDED</li>
 *   <li>runner reports failure: FAILED</li>
 *   <li>timeout: FAILED / TIMED_OUT</li>
 *   <li>{@link ActionTransportException} or a saturated runner pool: FAILED / TRANSPORT_ERROR</li>
 *   <li>cancelled or interrupted: FAILED / CANCELLED</li>
 * </ul>
 *
 * <p>Executions still queued at shutdown stay PENDING in history and are re-queued on the next
 * start by {@link com.remediation.recovery.StartupRecoveryService}.
 */
@Component
@EnableConfigurationProperties(ExecutionConfig.class)
public class ExecutionWorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWorkerPool.class);

    private final ExecutionQueue executionQueue;
    private final ExecutionStateManager stateManager;
    private final ActionRunner actionRunner;
    private final AsyncTaskExecutor actionRunnerExecutor;
    private final ExecutionConfig config;

    private final ConcurrentMap<String, Future<ActionResult>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentMap<Duration, TimeLimiter> timeLimiters = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();

    public ExecutionWorkerPool(
            ExecutionQueue executionQueue,
            ExecutionStateManager stateManager,
            ActionRunner actionRunner,
            @Qualifier("actionRunnerExecutor") AsyncTaskExecutor actionRunnerExecutor,
            ExecutionConfig config) {
        this.executionQueue = executionQueue;
        this.stateManager = stateManager;
        this.actionRunner = actionRunner;
        this.actionRunnerExecutor = actionRunnerExecutor;
        this.config = config;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            synchronized (workers) {
                for (int i = 1; i <= config.getWorkerCount(); i++) {
                    Thread worker = new Thread(this::workLoop, "execution-worker-" + i);
                    worker.setDaemon(true);
                    worker.start();
                    workers.add(worker);
                }
            }
            log.info("ExecutionWorkerPool started with {} workers", config.getWorkerCount());
        }
    }

    /**
     * Stops taking new work and interrupts the workers. Actions in flight are cancelled and their
     * executions end with outcome CANCELLED.
     */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            synchronized (workers) {
                workers.forEach(Thread::interrupt);
                workers.clear();
            }
            log.info("ExecutionWorkerPool stopping, {} action(s) in flight", inFlight.size());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void workLoop() {
        while (running.get()) {
            try {
                QueuedExecution queued = executionQueue.take();
                process(queued);
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.debug("{} interrupted during shutdown", Thread.currentThread().getName());
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("{} interrupted unexpectedly, resuming", Thread.currentThread().getName());
            } catch (RuntimeException e) {
                log.error("Unexpected error in {}", Thread.currentThread().getName(), e);
            }
        }
    }

    // ========================
    // PROCESSING
    // ========================

    /**
     * Runs one queued execution to completion. Skips it if it is no longer PENDING.
     */
    public void process(QueuedExecution queued) {
        long queueLatency = System.currentTimeMillis() - queued.getEnqueuedAt();
        Optional<Execution> started = stateManager.markRunning(queued.getExecutionId());
        if (started.isEmpty()) {
            return;
        }

        Execution execution = started.get();
        Runbook runbook = execution.getRunbookSnapshot();
        Duration timeout = timeoutFor(runbook);
        log.info(
                "Running execution {}: runbook={}, scope={}, timeout={}s, queueLatency={}ms",
                execution.getId(),
                execution.getRunbookId(),
                execution.getScopeKey(),
                timeout.toSeconds(),
                queueLatency);

        ExecutionTarget target = ExecutionTarget.builder()
                .executionId(execution.getId())
                .scopeType(execution.getScopeType())
                .scopeId(execution.getScopeId())
                .variables(execution.getVariables())
                .build();

        ExecutionOutcome outcome;
        String detail;
        boolean interrupted = false;
        try {
            Future<ActionResult> future = actionRunnerExecutor.submit(() -> actionRunner.execute(runbook, target));
            inFlight.put(execution.getId(), future);
            ActionResult result = timeLimiterFor(timeout).executeFutureSupplier(() -> future);
            if (result == null) {
                outcome = ExecutionOutcome.FAILED;
                detail = "Action runner returned no result";
            } else {
                outcome = result.isSuccess() ? ExecutionOutcome.SUCCEEDED : ExecutionOutcome.FAILED;
                detail = result.getDetail();
            }
        } catch (TimeoutException e) {
            outcome = ExecutionOutcome.TIMED_OUT;
            detail = "Action did not finish within " + timeout.toSeconds() + "s";
        } catch (CancellationException e) {
            outcome = ExecutionOutcome.CANCELLED;
            detail = "Action cancelled";
        } catch (ActionTransportException e) {
            outcome = ExecutionOutcome.TRANSPORT_ERROR;
            detail = e.getMessage();
        } catch (TaskRejectedException e) {
            outcome = ExecutionOutcome.TRANSPORT_ERROR;
            detail = "Action runner pool saturated";
        } catch (InterruptedException e) {
            interrupted = true;
            cancelFuture(execution.getId());
            outcome = ExecutionOutcome.CANCELLED;
            detail = "Worker interrupted";
        } catch (Exception e) {
            log.error("Action runner failed for execution {}", execution.getId(), e);
            outcome = ExecutionOutcome.FAILED;
            detail = "Action runner error: " + e.getMessage();
        } finally {
            inFlight.remove(execution.getId());
        }

        stateManager.complete(execution.getId(), outcome, detail);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Interrupts the action of a running execution, if this process is running it.
     *
     * @return true if an in-flight action was found
     */
    public boolean cancel(String executionId) {
        boolean found = cancelFuture(executionId);
        if (found) {
            log.info("In-flight action of execution {} cancelled", executionId);
        }
        return found;
    }

    public boolean isInFlight(String executionId) {
        return inFlight.containsKey(executionId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private boolean cancelFuture(String executionId) {
        Future<ActionResult> future = inFlight.get(executionId);
        if (future == null) {
            return false;
        }
        future.cancel(true);
        return true;
    }

    Duration timeoutFor(Runbook runbook) {
        if (runbook != null && runbook.getTimeoutSeconds() != null && runbook.getTimeoutSeconds() > 0) {
            return Duration.ofSeconds(runbook.getTimeoutSeconds());
        }
        return config.getDefaultActionTimeout();
    }

    private TimeLimiter timeLimiterFor(Duration timeout) {
        return timeLimiters.computeIfAbsent(timeout, t -> TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(t)
                .cancelRunningFuture(true)
                .build()));
    }
}

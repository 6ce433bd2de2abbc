package com.remediation.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.remediation.circuit.CircuitBreakerConfig;
import com.remediation.circuit.CircuitBreakerService;
import com.remediation.domain.enums.CircuitState;
import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.ActionResult;
import com.remediation.domain.model.Alert;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.RateLimitPolicy;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.ScopeKey;
import com.remediation.event.CircuitBreakerEvent;
import com.remediation.event.EventPublisherHelper;
import com.remediation.exception.InvalidExecutionStateException;
import com.remediation.matching.PatternMatcher;
import com.remediation.matching.TriggerMatcher;
import com.remediation.orchestration.BlackoutPolicy;
import com.remediation.orchestration.ExecutionConfig;
import com.remediation.orchestration.ExecutionOrchestrator;
import com.remediation.orchestration.ExecutionQueue;
import com.remediation.orchestration.ExecutionStateManager;
import com.remediation.orchestration.ExecutionWorkerPool;
import com.remediation.orchestration.QueuedExecution;
import com.remediation.ratelimit.RateLimiterConfig;
import com.remediation.ratelimit.RateLimiterService;
import com.remediation.runner.ActionRunner;
import com.remediation.service.RemediationService;
import com.remediation.support.Fixtures;
import com.remediation.support.InMemoryCircuitBreakerStateStore;
import com.remediation.support.InMemoryExecutionHistoryStore;
import com.remediation.support.InMemoryRateLimitWindowStore;
import com.remediation.support.InMemoryTriggerCatalog;
import com.remediation.support.MutableClock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

/**
 * Cross-service integration test for the alert to outcome flow.
 * Wires real matcher, breaker, rate limiter, orchestrator, state manager and worker pool over
 * in-memory stores, with a scripted action runner. Queued executions are drained by hand so
 * every step is deterministic.
 */
class AlertRemediationFlowIntegrationTest {

    private static final ScopeKey WEB_01 = new ScopeKey("host", "web-01");

    private MutableClock clock;
    private InMemoryTriggerCatalog catalog;
    private InMemoryExecutionHistoryStore historyStore;
    private CircuitBreakerService circuitBreakerService;
    private ExecutionQueue executionQueue;
    private ExecutionWorkerPool workerPool;
    private RemediationService remediationService;

    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final Deque<ActionResult> scriptedResults = new ArrayDeque<>();
    private final AtomicInteger actionCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Fixtures.NOW);
        catalog = new InMemoryTriggerCatalog();
        historyStore = new InMemoryExecutionHistoryStore();
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events::add);

        CircuitBreakerConfig breakerConfig = new CircuitBreakerConfig();
        circuitBreakerService = new CircuitBreakerService(
                new InMemoryCircuitBreakerStateStore(), breakerConfig, eventPublisherHelper, clock);
        RateLimiterService rateLimiterService =
                new RateLimiterService(new InMemoryRateLimitWindowStore(), new RateLimiterConfig(), clock);

        ExecutionConfig executionConfig = new ExecutionConfig();
        ExecutionStateManager stateManager =
                new ExecutionStateManager(historyStore, circuitBreakerService, eventPublisherHelper, clock);
        executionQueue = new ExecutionQueue();

        ActionRunner actionRunner = (runbook, target) -> {
            actionCalls.incrementAndGet();
            synchronized (scriptedResults) {
                return scriptedResults.isEmpty() ? ActionResult.success("ok") : scriptedResults.poll();
            }
        };
        workerPool = new ExecutionWorkerPool(
                executionQueue, stateManager, actionRunner, new SimpleAsyncTaskExecutor("action-"), executionConfig);

        TriggerMatcher triggerMatcher = new TriggerMatcher(catalog, new PatternMatcher(), eventPublisherHelper);
        ExecutionOrchestrator orchestrator = new ExecutionOrchestrator(
                triggerMatcher,
                catalog,
                circuitBreakerService,
                rateLimiterService,
                new BlackoutPolicy(),
                stateManager,
                executionQueue,
                workerPool,
                historyStore,
                executionConfig,
                clock);

        remediationService = new RemediationService(
                orchestrator,
                stateManager,
                historyStore,
                circuitBreakerService,
                rateLimiterService,
                catalog,
                executionConfig,
                Runnable::run,
                clock);

        catalog.addRunbook(Fixtures.autoRunbook(1L, "nginx")).addTrigger(Fixtures.globTrigger(1L, "Nginx*", 1L, 10));
    }

    private void script(ActionResult... results) {
        synchronized (scriptedResults) {
            scriptedResults.addAll(List.of(results));
        }
    }

    private void drainQueue() {
        QueuedExecution queued;
        while ((queued = executionQueue.poll()) != null) {
            workerPool.process(queued);
        }
    }

    private Alert nginxDown(String alertId) {
        return Fixtures.alert("NginxDown", "web-01").toBuilder().id(alertId).build();
    }

    private Execution runAlert(String alertId) {
        List<Execution> executions = remediationService.ingestAlert(nginxDown(alertId));
        assertThat(executions).hasSize(1);
        drainQueue();
        return remediationService.getExecutionStatus(executions.get(0).getId());
    }

    @Test
    @DisplayName("Matching alert runs its runbook to success")
    void alertRunsToSuccess() {
        Execution execution = runAlert("a-1");

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(execution.getOutcome()).isEqualTo(ExecutionOutcome.SUCCEEDED);
        assertThat(execution.getStartedAt()).isNotNull();
        assertThat(actionCalls.get()).isEqualTo(1);
        assertThat(circuitBreakerService.getState(WEB_01).orElseThrow().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Non-matching alert creates nothing")
    void nonMatchingAlert() {
        assertThat(remediationService.ingestAlert(Fixtures.alert("DiskFull", "db-01"))).isEmpty();
        assertThat(historyStore.all()).isEmpty();
    }

    @Test
    @DisplayName("Consecutive failures open the breaker, a successful probe closes it")
    void breakerOpensAndRecovers() {
        script(ActionResult.failure("exit 1"), ActionResult.failure("exit 1"), ActionResult.failure("exit 1"));
        runAlert("a-1");
        runAlert("a-2");
        runAlert("a-3");

        List<Execution> blocked = remediationService.ingestAlert(nginxDown("a-4"));
        assertThat(blocked.get(0).getStatus()).isEqualTo(ExecutionStatus.CIRCUIT_OPEN);
        assertThat(executionQueue.isEmpty()).isTrue();
        assertThat(actionCalls.get()).isEqualTo(3);

        clock.advance(Duration.ofMinutes(30));
        Execution probe = runAlert("a-5");

        assertThat(probe.isProbe()).isTrue();
        assertThat(probe.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(circuitBreakerService.getState(WEB_01).orElseThrow().getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(events)
                .filteredOn(CircuitBreakerEvent.class::isInstance)
                .extracting(e -> ((CircuitBreakerEvent) e).getCurrentState())
                .containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Cancelling the queued probe lets the next alert probe instead of being blocked")
    void cancelledProbeFreesSlot() {
        script(ActionResult.failure("exit 1"), ActionResult.failure("exit 1"), ActionResult.failure("exit 1"));
        runAlert("a-1");
        runAlert("a-2");
        runAlert("a-3");
        clock.advance(Duration.ofMinutes(30));

        Execution probe = remediationService.ingestAlert(nginxDown("a-4")).get(0);
        assertThat(probe.isProbe()).isTrue();
        remediationService.cancel(probe.getId(), "alice", "restarted by hand");
        assertThat(circuitBreakerService.getState(WEB_01).orElseThrow().getProbeExecutionId())
                .isNull();

        clock.advance(Duration.ofMinutes(10));
        Execution next = remediationService.ingestAlert(nginxDown("a-5")).get(0);

        assertThat(next.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(next.isProbe()).isTrue();
        drainQueue();
        assertThat(remediationService.getExecutionStatus(probe.getId()).getStatus())
                .isEqualTo(ExecutionStatus.SKIPPED);
        assertThat(circuitBreakerService.getState(WEB_01).orElseThrow().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Breaker on one host leaves other hosts alone")
    void breakerIsPerScope() {
        remediationService.openCircuit(WEB_01, "maintenance");

        List<Execution> web01 = remediationService.ingestAlert(nginxDown("a-1"));
        List<Execution> web02 =
                remediationService.ingestAlert(Fixtures.alert("NginxDown", "web-02").toBuilder().id("a-2").build());

        assertThat(web01.get(0).getStatus()).isEqualTo(ExecutionStatus.CIRCUIT_OPEN);
        assertThat(web02.get(0).getStatus()).isEqualTo(ExecutionStatus.PENDING);
    }

    @Test
    @DisplayName("Second alert inside the rate window is limited, the next window admits again")
    void rateLimited() {
        Runbook limited = Fixtures.autoRunbook(1L, "nginx");
        limited.setRateLimit(RateLimitPolicy.builder().maxExecutions(1).windowSeconds(60).build());
        catalog.addRunbook(limited);

        assertThat(runAlert("a-1").getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);

        Execution second = remediationService.ingestAlert(nginxDown("a-2")).get(0);
        assertThat(second.getStatus()).isEqualTo(ExecutionStatus.RATE_LIMITED);
        assertThat(second.getOutcome()).isNull();

        clock.advance(Duration.ofSeconds(60));
        assertThat(runAlert("a-3").getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(actionCalls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Execution requiring approval never runs until approved")
    void approvalGate() {
        Runbook guarded = Fixtures.autoRunbook(1L, "nginx");
        guarded.setApprovalRequired(true);
        catalog.addRunbook(guarded);

        Execution awaiting = remediationService.ingestAlert(nginxDown("a-1")).get(0);
        drainQueue();

        assertThat(remediationService.getExecutionStatus(awaiting.getId()).getStatus())
                .isEqualTo(ExecutionStatus.APPROVAL_REQUIRED);
        assertThat(actionCalls.get()).isZero();
        assertThat(remediationService.listPendingApprovals()).extracting(Execution::getId).containsExactly(awaiting.getId());

        remediationService.approve(awaiting.getId(), "alice");
        drainQueue();

        Execution done = remediationService.getExecutionStatus(awaiting.getId());
        assertThat(done.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(done.getDecidedBy()).isEqualTo("alice");
        assertThatThrownBy(() -> remediationService.approve(awaiting.getId(), "bob"))
                .isInstanceOf(InvalidExecutionStateException.class);
    }

    @Test
    @DisplayName("Replayed outcome does not count twice toward the breaker")
    void outcomeIdempotent() {
        script(ActionResult.failure("exit 1"), ActionResult.failure("exit 1"));
        Execution first = runAlert("a-1");
        runAlert("a-2");

        circuitBreakerService.recordOutcome(WEB_01, first.getId(), ExecutionOutcome.FAILED);
        circuitBreakerService.recordOutcome(WEB_01, first.getId(), ExecutionOutcome.FAILED);

        assertThat(circuitBreakerService.getState(WEB_01).orElseThrow().getConsecutiveFailures()).isEqualTo(2);
        assertThat(circuitBreakerService.getState(WEB_01).orElseThrow().getState()).isEqualTo(CircuitState.CLOSED);
    }
}

package com.remediation.unit.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.remediation.circuit.CircuitBreakerService;
import com.remediation.domain.enums.AdmissionDecision;
import com.remediation.domain.enums.BlackoutScope;
import com.remediation.domain.enums.ExecutionMode;
import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.enums.RateLimitDecision;
import com.remediation.domain.model.Alert;
import com.remediation.domain.model.BlackoutWindow;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.ScopeKey;
import com.remediation.domain.model.Trigger;
import com.remediation.event.EventPublisherHelper;
import com.remediation.exception.StateReadException;
import com.remediation.exception.TriggerConfigurationException;
import com.remediation.matching.TriggerCandidate;
import com.remediation.matching.TriggerMatcher;
import com.remediation.orchestration.BlackoutPolicy;
import com.remediation.orchestration.ExecutionConfig;
import com.remediation.orchestration.ExecutionOrchestrator;
import com.remediation.orchestration.ExecutionQueue;
import com.remediation.orchestration.ExecutionStateManager;
import com.remediation.orchestration.ExecutionWorkerPool;
import com.remediation.ratelimit.RateLimiterService;
import com.remediation.repository.TriggerCatalog;
import com.remediation.support.Fixtures;
import com.remediation.support.InMemoryExecutionHistoryStore;
import com.remediation.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for ExecutionOrchestrator gate ordering and operator decisions. Breaker, rate limiter and
 * matcher are mocked; state manager, queue and blackout policy are real.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionOrchestratorTest {

    private static final ScopeKey SCOPE = new ScopeKey("host", "web-01");

    @Mock
    private TriggerMatcher triggerMatcher;

    @Mock
    private TriggerCatalog triggerCatalog;

    @Mock
    private CircuitBreakerService circuitBreakerService;

    @Mock
    private RateLimiterService rateLimiterService;

    @Mock
    private ExecutionWorkerPool workerPool;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private InMemoryExecutionHistoryStore historyStore;
    private ExecutionStateManager stateManager;
    private ExecutionQueue executionQueue;
    private ExecutionConfig config;
    private ExecutionOrchestrator orchestrator;

    private final Alert alert = Fixtures.alert("NginxDown", "web-01").toBuilder()
            .label("env", "production")
            .build();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Fixtures.NOW);
        historyStore = new InMemoryExecutionHistoryStore();
        stateManager = new ExecutionStateManager(historyStore, circuitBreakerService, eventPublisherHelper, clock);
        executionQueue = new ExecutionQueue();
        config = new ExecutionConfig();
        orchestrator = new ExecutionOrchestrator(
                triggerMatcher,
                triggerCatalog,
                circuitBreakerService,
                rateLimiterService,
                new BlackoutPolicy(),
                stateManager,
                executionQueue,
                workerPool,
                historyStore,
                config,
                clock);
    }

    private void givenCandidates(TriggerCandidate... candidates) {
        when(triggerMatcher.findCandidates(alert)).thenReturn(List.of(candidates));
        when(triggerCatalog.listEnabledBlackoutWindows()).thenReturn(List.of());
    }

    private TriggerCandidate candidate(Trigger trigger, Runbook runbook) {
        return new TriggerCandidate(trigger, runbook);
    }

    private TriggerCandidate autoCandidate() {
        return candidate(Fixtures.globTrigger(1L, "Nginx*", 1L, 5), Fixtures.autoRunbook(1L, "nginx"));
    }

    private Runbook approvalRunbook() {
        Runbook runbook = Fixtures.autoRunbook(2L, "db-failover");
        runbook.setApprovalRequired(true);
        return runbook;
    }

    @Nested
    @DisplayName("Admission")
    class Admission {

        @Test
        @DisplayName("Candidate passing every gate is recorded PENDING and queued")
        void autoDispatch() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);

            List<Execution> executions = orchestrator.process(alert);

            assertThat(executions).hasSize(1);
            Execution execution = executions.get(0);
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(execution.isProbe()).isFalse();
            assertThat(execution.getScopeKey()).isEqualTo(SCOPE);
            assertThat(execution.getVariables())
                    .containsEntry("alert.name", "NginxDown")
                    .containsEntry("labels.env", "production");
            assertThat(executionQueue.contains(execution.getId())).isTrue();
            assertThat(historyStore.findById(execution.getId())).isPresent();
        }

        @Test
        @DisplayName("Variables captured at match time are handed to the execution")
        void capturedVariablesOnExecution() {
            givenCandidates(new TriggerCandidate(
                    Fixtures.globTrigger(1L, "*", 1L, 5), Fixtures.autoRunbook(1L, "nginx"), Map.of("service", "Nginx")));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getVariables())
                    .containsEntry("service", "Nginx")
                    .containsEntry("alert.scope", "web-01");
        }

        @Test
        @DisplayName("No matching trigger creates nothing")
        void noCandidates() {
            when(triggerMatcher.findCandidates(alert)).thenReturn(List.of());

            assertThat(orchestrator.process(alert)).isEmpty();
            verifyNoInteractions(circuitBreakerService, rateLimiterService, triggerCatalog);
        }

        @Test
        @DisplayName("Open breaker records CIRCUIT_OPEN without consulting the rate limiter")
        void circuitOpen() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.DENY);

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CIRCUIT_OPEN);
            assertThat(execution.getCompletedAt()).isEqualTo(Fixtures.NOW);
            assertThat(executionQueue.isEmpty()).isTrue();
            verifyNoInteractions(rateLimiterService);
        }

        @Test
        @DisplayName("Unreadable breaker state is treated as open")
        void breakerStateUnavailable() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString()))
                    .thenThrow(new StateReadException("db down", null));

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.CIRCUIT_OPEN);
            assertThat(execution.getOutcomeDetail()).contains("unavailable");
        }

        @Test
        @DisplayName("Exhausted rate limit records RATE_LIMITED and hands back a probe slot")
        void rateLimitedReleasesProbe() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW_AS_PROBE);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.DENY);

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.RATE_LIMITED);
            verify(circuitBreakerService).releaseProbe(SCOPE, execution.getId());
            assertThat(executionQueue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Runbook with an invalid rate limit is recorded RATE_LIMITED, not dispatched")
        void invalidRateLimitFailsClosed() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW_AS_PROBE);
            when(rateLimiterService.admit(any()))
                    .thenThrow(TriggerConfigurationException.forRunbook(1L, "the window must be positive"));

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.RATE_LIMITED);
            assertThat(execution.getOutcomeDetail()).startsWith("Invalid rate limit");
            verify(circuitBreakerService).releaseProbe(SCOPE, execution.getId());
            assertThat(executionQueue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Probe admission is carried on the dispatched execution")
        void probeDispatched() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW_AS_PROBE);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.isProbe()).isTrue();
            verify(circuitBreakerService, never()).releaseProbe(any(), anyString());
        }

        @Test
        @DisplayName("Active blackout skips the candidate before the rate limiter")
        void blackoutSkips() {
            BlackoutWindow window = BlackoutWindow.builder()
                    .id(1L)
                    .name("change-freeze")
                    .enabled(true)
                    .startTime(Fixtures.NOW.minusSeconds(60))
                    .endTime(Fixtures.NOW.plusSeconds(3600))
                    .appliesTo(BlackoutScope.ALL)
                    .build();
            when(triggerMatcher.findCandidates(alert)).thenReturn(List.of(autoCandidate()));
            when(triggerCatalog.listEnabledBlackoutWindows()).thenReturn(List.of(window));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
            assertThat(execution.getOutcomeDetail()).isEqualTo("Blackout window active: change-freeze");
            verifyNoInteractions(rateLimiterService);
        }

        @Test
        @DisplayName("Each candidate gets its own execution even when one is refused")
        void candidatesIndependent() {
            Runbook other = Fixtures.autoRunbook(3L, "cache");
            other.setTargetScopeType("service");
            givenCandidates(autoCandidate(), candidate(Fixtures.globTrigger(2L, "*", 3L, 1), other));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.DENY);
            when(circuitBreakerService.admit(eq(new ScopeKey("service", "web-01")), anyString()))
                    .thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(other)).thenReturn(RateLimitDecision.ALLOW);

            List<Execution> executions = orchestrator.process(alert);

            assertThat(executions)
                    .extracting(Execution::getStatus)
                    .containsExactly(ExecutionStatus.CIRCUIT_OPEN, ExecutionStatus.PENDING);
        }

        @Test
        @DisplayName("Runbook without scope type uses the configured default")
        void defaultScopeType() {
            Runbook runbook = Fixtures.autoRunbook(1L, "nginx");
            runbook.setTargetScopeType(null);
            config.setDefaultScopeType("node");
            givenCandidates(candidate(Fixtures.globTrigger(1L, "*", 1L, 1), runbook));
            when(circuitBreakerService.admit(eq(new ScopeKey("node", "web-01")), anyString()))
                    .thenReturn(AdmissionDecision.DENY);

            assertThat(orchestrator.process(alert).get(0).getScopeType()).isEqualTo("node");
        }
    }

    @Nested
    @DisplayName("Approval")
    class Approval {

        @Test
        @DisplayName("Runbook requiring approval waits and is never queued")
        void awaitsApproval() {
            givenCandidates(candidate(Fixtures.globTrigger(1L, "*", 2L, 1), approvalRunbook()));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);

            Execution execution = orchestrator.process(alert).get(0);

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.APPROVAL_REQUIRED);
            assertThat(execution.getApprovalExpiresAt()).isEqualTo(Fixtures.NOW.plus(Duration.ofHours(4)));
            assertThat(executionQueue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Trigger in approval mode overrides an auto-executable runbook")
        void triggerApprovalMode() {
            Trigger trigger = Fixtures.globTrigger(1L, "*", 1L, 1);
            trigger.setExecutionMode(ExecutionMode.APPROVAL_REQUIRED);
            givenCandidates(candidate(trigger, Fixtures.autoRunbook(1L, "nginx")));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);

            assertThat(orchestrator.process(alert).get(0).getStatus()).isEqualTo(ExecutionStatus.APPROVAL_REQUIRED);
        }

        @Test
        @DisplayName("Approval queues the execution without consulting the breaker again")
        void approveQueues() {
            givenCandidates(candidate(Fixtures.globTrigger(1L, "*", 2L, 7), approvalRunbook()));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);
            String id = orchestrator.process(alert).get(0).getId();

            Execution approved = orchestrator.approve(id, "alice");

            assertThat(approved.getStatus()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(executionQueue.poll().getPriority()).isEqualTo(7);
            verify(circuitBreakerService).admit(eq(SCOPE), anyString());
        }

        @Test
        @DisplayName("Reject leaves nothing queued")
        void rejectSkips() {
            givenCandidates(candidate(Fixtures.globTrigger(1L, "*", 2L, 1), approvalRunbook()));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);
            String id = orchestrator.process(alert).get(0).getId();

            assertThat(orchestrator.reject(id, "bob", "not now").getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
            assertThat(executionQueue.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Cancellation and housekeeping")
    class Housekeeping {

        private String dispatch() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);
            String id = orchestrator.process(alert).get(0).getId();
            executionQueue.poll();
            return id;
        }

        @Test
        @DisplayName("Cancelling a running execution interrupts the in-flight action")
        void cancelRunning() {
            String id = dispatch();
            stateManager.markRunning(id);

            Execution cancelled = orchestrator.cancel(id, "alice", "manual fix");

            assertThat(cancelled.getOutcome()).isEqualTo(ExecutionOutcome.CANCELLED);
            verify(workerPool).cancel(id);
        }

        @Test
        @DisplayName("Cancelling a queued execution skips it")
        void cancelPending() {
            String id = dispatch();

            assertThat(orchestrator.cancel(id, "alice", null).getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
            verify(workerPool, never()).cancel(anyString());
        }

        @Test
        @DisplayName("Cancelling a queued probe hands the probe slot back to the breaker")
        void cancelPendingProbeReleasesSlot() {
            givenCandidates(autoCandidate());
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW_AS_PROBE);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);
            String id = orchestrator.process(alert).get(0).getId();

            Execution cancelled = orchestrator.cancel(id, "alice", "fixed by hand");

            assertThat(cancelled.getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
            verify(circuitBreakerService).releaseProbe(SCOPE, id);
        }

        @Test
        @DisplayName("Cancelling a queued non-probe execution leaves the breaker alone")
        void cancelPendingNonProbeKeepsBreaker() {
            String id = dispatch();

            orchestrator.cancel(id, "alice", null);

            verify(circuitBreakerService, never()).releaseProbe(any(), anyString());
        }

        @Test
        @DisplayName("Runbook timeout longer than the stale threshold extends it")
        void longRunbookTimeoutNotStale() {
            Runbook runbook = Fixtures.autoRunbook(1L, "reindex");
            runbook.setTimeoutSeconds(3600);
            givenCandidates(candidate(Fixtures.globTrigger(1L, "*", 1L, 1), runbook));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);
            String id = orchestrator.process(alert).get(0).getId();
            stateManager.markRunning(id);

            clock.advance(Duration.ofMinutes(31));
            assertThat(orchestrator.reconcileStaleExecutions()).isZero();
            assertThat(stateManager.get(id).getStatus()).isEqualTo(ExecutionStatus.RUNNING);

            clock.advance(Duration.ofMinutes(35));
            assertThat(orchestrator.reconcileStaleExecutions()).isEqualTo(1);
            assertThat(stateManager.get(id).getOutcome()).isEqualTo(ExecutionOutcome.TIMED_OUT);
            verify(circuitBreakerService).recordOutcome(SCOPE, id, ExecutionOutcome.TIMED_OUT);
        }

        @Test
        @DisplayName("Action still in flight in this process is not reconciled")
        void inFlightNotReconciled() {
            String id = dispatch();
            stateManager.markRunning(id);
            when(workerPool.isInFlight(id)).thenReturn(true);
            clock.advance(Duration.ofHours(2));

            assertThat(orchestrator.reconcileStaleExecutions()).isZero();
            assertThat(stateManager.get(id).getStatus()).isEqualTo(ExecutionStatus.RUNNING);
            verify(circuitBreakerService, never()).recordOutcome(any(), anyString(), any());
        }

        @Test
        @DisplayName("Stale RUNNING executions are failed as TIMED_OUT")
        void reconcileStale() {
            String id = dispatch();
            stateManager.markRunning(id);
            clock.advance(Duration.ofMinutes(31));

            assertThat(orchestrator.reconcileStaleExecutions()).isEqualTo(1);
            assertThat(stateManager.get(id).getOutcome()).isEqualTo(ExecutionOutcome.TIMED_OUT);
            verify(circuitBreakerService).recordOutcome(SCOPE, id, ExecutionOutcome.TIMED_OUT);
        }

        @Test
        @DisplayName("Recent RUNNING executions are left alone")
        void recentRunningKept() {
            String id = dispatch();
            stateManager.markRunning(id);
            clock.advance(Duration.ofMinutes(5));

            assertThat(orchestrator.reconcileStaleExecutions()).isZero();
            assertThat(stateManager.get(id).getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        }

        @Test
        @DisplayName("PENDING executions from history are queued again")
        void requeuePending() {
            String id = dispatch();

            assertThat(orchestrator.requeuePendingExecutions()).isEqualTo(1);
            assertThat(executionQueue.contains(id)).isTrue();
        }

        @Test
        @DisplayName("Overdue approvals are expired")
        void expireApprovals() {
            givenCandidates(candidate(Fixtures.globTrigger(1L, "*", 2L, 1), approvalRunbook()));
            when(circuitBreakerService.admit(eq(SCOPE), anyString())).thenReturn(AdmissionDecision.ALLOW);
            when(rateLimiterService.admit(any())).thenReturn(RateLimitDecision.ALLOW);
            String id = orchestrator.process(alert).get(0).getId();
            clock.set(Instant.parse("2025-03-10T14:00:00Z"));

            assertThat(orchestrator.expireStaleApprovals()).isEqualTo(1);
            assertThat(stateManager.get(id).getStatus()).isEqualTo(ExecutionStatus.SKIPPED);
        }
    }
}

package com.remediation.circuit;

import com.remediation.domain.enums.AdmissionDecision;
import com.remediation.domain.enums.CircuitState;
import com.remediation.domain.enums.ExecutionOutcome;
import com.remediation.domain.model.CircuitBreakerState;
import com.remediation.domain.model.ScopeKey;
import com.remediation.event.EventPublisherHelper;
import com.remediation.exception.StateReadException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Per-scope circuit breaker guarding remediation targets.
 *
 * <p>State machine:
 * <ul>
 *   <li><b>CLOSED:</b> everything is admitted. {@code failureThreshold} consecutive failed outcomes
 *       open the breaker.</li>
 *   <li><b>OPEN:</b> everything is denied until {@code openUntil}. The open period starts at
 *       {@code openDuration} and grows by {@code backoffMultiplier} for every failed probe, capped at
 *       {@code maxOpenDuration}.</li>
 *   <li><b>HALF_OPEN:</b> exactly one execution is admitted as a probe. Its success closes the breaker,
 *       its failure reopens it with a longer open period.</li>
 * </ul>
 *
 * <p>A manually opened breaker stays OPEN until {@link #reset(ScopeKey)} regardless of time or outcomes.
 *
 * <p>All reads and writes for one scope are serialized on a per-scope monitor, so two concurrent
 * admissions can never both become the probe. Different scopes never contend.
 *
 * <p>Outcomes are idempotent per execution id: a replayed outcome is ignored.
 */
@Service
@EnableConfigurationProperties(CircuitBreakerConfig.class)
public class CircuitBreakerService {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerService.class);

    private final CircuitBreakerStateStore stateStore;
    private final CircuitBreakerConfig config;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ConcurrentMap<ScopeKey, Object> scopeLocks = new ConcurrentHashMap<>();

    public CircuitBreakerService(
            CircuitBreakerStateStore stateStore,
            CircuitBreakerConfig config,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.stateStore = stateStore;
        this.config = config;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // ADMISSION
    // ========================

    /**
     * Decides whether an execution against the scope may be dispatched.
     *
     * <p>When the breaker is OPEN and its open period has elapsed, this call moves it to HALF_OPEN and
     * hands the probe slot to {@code executionId}.
     *
     * @return ALLOW, ALLOW_AS_PROBE (the caller must later record an outcome or release the probe), or DENY
     * @throws StateReadException when state is unavailable and fail-open is not configured
     */
    public AdmissionDecision admit(ScopeKey scope, String executionId) {
        synchronized (lockFor(scope)) {
            try {
                return doAdmit(scope, executionId);
            } catch (StateReadException e) {
                if (config.isFailOpenOnStateError()) {
                    log.warn("Breaker state for {} unavailable, admitting (fail-open): {}", scope, e.getMessage());
                    return AdmissionDecision.ALLOW;
                }
                log.error("Breaker state for {} unavailable, denying execution {}", scope, executionId, e);
                throw e;
            }
        }
    }

    private AdmissionDecision doAdmit(ScopeKey scope, String executionId) {
        Optional<CircuitBreakerState> loaded = stateStore.load(scope);
        if (loaded.isEmpty()) {
            return AdmissionDecision.ALLOW;
        }

        CircuitBreakerState state = loaded.get();
        Instant now = clock.instant();

        if (state.isManuallyOpened()) {
            log.debug("Breaker {} manually open ({}), denying {}", scope, state.getManualReason(), executionId);
            return AdmissionDecision.DENY;
        }

        switch (state.getState()) {
            case CLOSED:
                return AdmissionDecision.ALLOW;

            case OPEN:
                if (state.getOpenUntil() != null && now.isBefore(state.getOpenUntil())) {
                    log.debug("Breaker {} open until {}, denying {}", scope, state.getOpenUntil(), executionId);
                    return AdmissionDecision.DENY;
                }
                transition(state, CircuitState.HALF_OPEN, now, "Open period elapsed");
                claimProbe(state, executionId, now);
                stateStore.save(state);
                log.info("Breaker {} half-open, execution {} is the probe", scope, executionId);
                return AdmissionDecision.ALLOW_AS_PROBE;

            case HALF_OPEN:
                if (state.getProbeExecutionId() != null && !isProbeLost(state, now)) {
                    log.debug(
                            "Breaker {} half-open with probe {} in flight, denying {}",
                            scope,
                            state.getProbeExecutionId(),
                            executionId);
                    return AdmissionDecision.DENY;
                }
                if (state.getProbeExecutionId() != null) {
                    log.warn(
                            "Breaker {} probe {} produced no outcome since {}, handing probe to {}",
                            scope,
                            state.getProbeExecutionId(),
                            state.getProbeStartedAt(),
                            executionId);
                }
                claimProbe(state, executionId, now);
                stateStore.save(state);
                return AdmissionDecision.ALLOW_AS_PROBE;

            default:
                throw new IllegalStateException("Unknown circuit state " + state.getState());
        }
    }

    // ========================
    // OUTCOMES
    // ========================

    /**
     * Records the outcome of an execution that ran against the scope.
     *
     * <p>CANCELLED is neutral: counters are untouched and a held probe slot is released.
     * A second call with the same execution id is ignored.
     */
    public void recordOutcome(ScopeKey scope, String executionId, ExecutionOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        synchronized (lockFor(scope)) {
            Instant now = clock.instant();
            CircuitBreakerState state = stateStore.load(scope).orElseGet(() -> CircuitBreakerState.closed(scope, now));

            if (executionId != null && state.getRecentExecutionIds().contains(executionId)) {
                log.debug("Outcome for execution {} on {} already recorded, ignoring {}", executionId, scope, outcome);
                return;
            }
            rememberExecution(state, executionId);

            boolean isProbe = executionId != null && executionId.equals(state.getProbeExecutionId());

            if (outcome == ExecutionOutcome.CANCELLED) {
                if (isProbe) {
                    clearProbe(state);
                    log.info("Probe {} on {} cancelled, probe slot released", executionId, scope);
                }
            } else if (outcome.isFailure()) {
                onFailure(state, isProbe, now, outcome);
            } else {
                onSuccess(state, isProbe, now);
            }

            state.setUpdatedAt(now);
            stateStore.save(state);
        }
    }

    private void onSuccess(CircuitBreakerState state, boolean isProbe, Instant now) {
        state.setConsecutiveFailures(0);
        if (state.getState() == CircuitState.HALF_OPEN && isProbe && !state.isManuallyOpened()) {
            clearProbe(state);
            state.setTripCount(0);
            state.setOpenUntil(null);
            transition(state, CircuitState.CLOSED, now, "Probe succeeded");
        }
    }

    private void onFailure(CircuitBreakerState state, boolean isProbe, Instant now, ExecutionOutcome outcome) {
        state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);
        if (state.isManuallyOpened()) {
            return;
        }

        if (state.getState() == CircuitState.CLOSED && state.getConsecutiveFailures() >= config.getFailureThreshold()) {
            state.setTripCount(1);
            open(state, now, state.getConsecutiveFailures() + " consecutive failures, last " + outcome);
        } else if (state.getState() == CircuitState.HALF_OPEN && isProbe) {
            clearProbe(state);
            state.setTripCount(state.getTripCount() + 1);
            open(state, now, "Probe failed with " + outcome);
        }
    }

    /**
     * Gives back the probe slot held by an execution that was admitted as probe but never dispatched.
     */
    public void releaseProbe(ScopeKey scope, String executionId) {
        synchronized (lockFor(scope)) {
            Optional<CircuitBreakerState> loaded = stateStore.load(scope);
            if (loaded.isEmpty()) {
                return;
            }
            CircuitBreakerState state = loaded.get();
            if (state.getState() == CircuitState.HALF_OPEN && Objects.equals(state.getProbeExecutionId(), executionId)) {
                clearProbe(state);
                state.setUpdatedAt(clock.instant());
                stateStore.save(state);
                log.info("Probe slot on {} released by {}", scope, executionId);
            }
        }
    }

    // ========================
    // OPERATOR CONTROLS
    // ========================

    /**
     * Opens the breaker until {@link #reset(ScopeKey)} is called.
     */
    public CircuitBreakerState forceOpen(ScopeKey scope, String reason) {
        synchronized (lockFor(scope)) {
            Instant now = clock.instant();
            CircuitBreakerState state = stateStore.load(scope).orElseGet(() -> CircuitBreakerState.closed(scope, now));
            state.setManuallyOpened(true);
            state.setManualReason(reason);
            state.setOpenUntil(null);
            clearProbe(state);
            if (state.getState() != CircuitState.OPEN) {
                transition(state, CircuitState.OPEN, now, "Manually opened: " + reason);
            }
            state.setUpdatedAt(now);
            log.warn("Breaker {} manually opened: {}", scope, reason);
            return stateStore.save(state);
        }
    }

    /**
     * Closes the breaker and clears counters, backoff and any manual hold.
     */
    public CircuitBreakerState reset(ScopeKey scope) {
        synchronized (lockFor(scope)) {
            Instant now = clock.instant();
            CircuitBreakerState state = stateStore.load(scope).orElseGet(() -> CircuitBreakerState.closed(scope, now));
            state.setManuallyOpened(false);
            state.setManualReason(null);
            state.setConsecutiveFailures(0);
            state.setTripCount(0);
            state.setOpenUntil(null);
            clearProbe(state);
            if (state.getState() != CircuitState.CLOSED) {
                transition(state, CircuitState.CLOSED, now, "Manual reset");
            }
            state.setUpdatedAt(now);
            log.info("Breaker {} reset", scope);
            return stateStore.save(state);
        }
    }

    public Optional<CircuitBreakerState> getState(ScopeKey scope) {
        return stateStore.load(scope);
    }

    // ========================
    // INTERNALS
    // ========================

    /**
     * Open period for the given trip: {@code openDuration * backoffMultiplier^(tripCount - 1)},
     * capped at {@code maxOpenDuration}.
     */
    Duration openDurationFor(int tripCount) {
        double factor = Math.pow(config.getBackoffMultiplier(), Math.max(0, tripCount - 1));
        double millis = config.getOpenDuration().toMillis() * factor;
        long capped = (long) Math.min(millis, config.getMaxOpenDuration().toMillis());
        return Duration.ofMillis(capped);
    }

    private void open(CircuitBreakerState state, Instant now, String reason) {
        Duration openFor = openDurationFor(state.getTripCount());
        state.setOpenUntil(now.plus(openFor));
        transition(state, CircuitState.OPEN, now, reason);
        log.warn(
                "Breaker {} opened for {}s (trip {}): {}",
                state.getScopeKey(),
                openFor.toSeconds(),
                state.getTripCount(),
                reason);
    }

    private void transition(CircuitBreakerState state, CircuitState target, Instant now, String reason) {
        CircuitState previous = state.getState();
        state.setState(target);
        state.setLastTransitionAt(now);
        eventPublisherHelper.publishCircuitTransition(this, state.getScopeKey(), previous, target, reason);
    }

    private void claimProbe(CircuitBreakerState state, String executionId, Instant now) {
        state.setProbeExecutionId(executionId);
        state.setProbeStartedAt(now);
        state.setUpdatedAt(now);
    }

    private void clearProbe(CircuitBreakerState state) {
        state.setProbeExecutionId(null);
        state.setProbeStartedAt(null);
    }

    private boolean isProbeLost(CircuitBreakerState state, Instant now) {
        return state.getProbeStartedAt() != null
                && !now.isBefore(state.getProbeStartedAt().plus(config.getProbeTimeout()));
    }

    private void rememberExecution(CircuitBreakerState state, String executionId) {
        if (executionId == null) {
            return;
        }
        List<String> recent = new ArrayList<>(state.getRecentExecutionIds());
        recent.add(executionId);
        while (recent.size() > config.getIdempotencyWindow()) {
            recent.remove(0);
        }
        state.setRecentExecutionIds(recent);
    }

    private Object lockFor(ScopeKey scope) {
        return scopeLocks.computeIfAbsent(scope, k -> new Object());
    }
}

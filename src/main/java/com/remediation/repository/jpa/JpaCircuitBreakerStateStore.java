package com.remediation.repository.jpa;

import com.remediation.circuit.CircuitBreakerStateStore;
import com.remediation.domain.model.CircuitBreakerState;
import com.remediation.domain.model.ScopeKey;
import com.remediation.entity.CircuitBreakerStateEntity;
import com.remediation.exception.StateReadException;
import com.remediation.mapper.CircuitBreakerStateMapper;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link CircuitBreakerStateStore} backed by the circuit_breaker_states table. Database failures
 * surface as {@link StateReadException}.
 */
@Component
@Transactional
public class JpaCircuitBreakerStateStore implements CircuitBreakerStateStore {

    private final CircuitBreakerStateJpaRepository circuitBreakerStateJpaRepository;
    private final CircuitBreakerStateMapper circuitBreakerStateMapper;

    public JpaCircuitBreakerStateStore(
            CircuitBreakerStateJpaRepository circuitBreakerStateJpaRepository,
            CircuitBreakerStateMapper circuitBreakerStateMapper) {
        this.circuitBreakerStateJpaRepository = circuitBreakerStateJpaRepository;
        this.circuitBreakerStateMapper = circuitBreakerStateMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CircuitBreakerState> load(ScopeKey scope) {
        try {
            return circuitBreakerStateJpaRepository
                    .findByScopeTypeAndScopeId(scope.scopeType(), scope.scopeId())
                    .map(circuitBreakerStateMapper::toDomain);
        } catch (DataAccessException e) {
            throw new StateReadException("Failed to load breaker state for " + scope, e);
        }
    }

    @Override
    public CircuitBreakerState save(CircuitBreakerState state) {
        try {
            CircuitBreakerStateEntity entity = circuitBreakerStateMapper.toEntity(state);
            if (entity.getId() == null) {
                circuitBreakerStateJpaRepository
                        .findByScopeTypeAndScopeId(state.getScopeType(), state.getScopeId())
                        .ifPresent(existing -> entity.setId(existing.getId()));
            }
            CircuitBreakerState saved = circuitBreakerStateMapper.toDomain(circuitBreakerStateJpaRepository.save(entity));
            state.setId(saved.getId());
            return saved;
        } catch (DataAccessException e) {
            throw new StateReadException("Failed to save breaker state for " + state.getScopeKey(), e);
        }
    }
}

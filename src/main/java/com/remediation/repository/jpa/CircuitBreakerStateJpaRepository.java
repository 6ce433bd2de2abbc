package com.remediation.repository.jpa;

import com.remediation.entity.CircuitBreakerStateEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CircuitBreakerStateJpaRepository extends JpaRepository<CircuitBreakerStateEntity, Long> {

    Optional<CircuitBreakerStateEntity> findByScopeTypeAndScopeId(String scopeType, String scopeId);
}

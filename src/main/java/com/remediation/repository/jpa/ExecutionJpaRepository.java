package com.remediation.repository.jpa;

import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.entity.ExecutionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the executions table. Status lookups back the recovery sweeps and the
 * pending-approval listing.
 */
@Repository
public interface ExecutionJpaRepository extends JpaRepository<ExecutionEntity, String> {

    List<ExecutionEntity> findByStatus(ExecutionStatus status);
}

package com.remediation.repository.jpa;

import com.remediation.domain.enums.ExecutionStatus;
import com.remediation.domain.model.Execution;
import com.remediation.mapper.ExecutionMapper;
import com.remediation.repository.ExecutionHistoryStore;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link ExecutionHistoryStore} backed by the executions table.
 */
@Component
@Transactional
public class JpaExecutionHistoryStore implements ExecutionHistoryStore {

    private final ExecutionJpaRepository executionJpaRepository;
    private final ExecutionMapper executionMapper;

    public JpaExecutionHistoryStore(ExecutionJpaRepository executionJpaRepository, ExecutionMapper executionMapper) {
        this.executionJpaRepository = executionJpaRepository;
        this.executionMapper = executionMapper;
    }

    @Override
    public Execution create(Execution execution) {
        return executionMapper.toDomain(executionJpaRepository.save(executionMapper.toEntity(execution)));
    }

    @Override
    public Execution update(Execution execution) {
        return executionMapper.toDomain(executionJpaRepository.save(executionMapper.toEntity(execution)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Execution> findById(String executionId) {
        return executionJpaRepository.findById(executionId).map(executionMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Execution> findByStatus(ExecutionStatus status) {
        return executionMapper.toDomainList(executionJpaRepository.findByStatus(status));
    }
}

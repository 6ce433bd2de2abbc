package com.remediation.repository.jpa;

import com.remediation.entity.RunbookEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RunbookJpaRepository extends JpaRepository<RunbookEntity, Long> {}

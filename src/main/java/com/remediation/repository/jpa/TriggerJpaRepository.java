package com.remediation.repository.jpa;

import com.remediation.entity.TriggerEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TriggerJpaRepository extends JpaRepository<TriggerEntity, Long> {

    List<TriggerEntity> findByEnabledTrue();
}

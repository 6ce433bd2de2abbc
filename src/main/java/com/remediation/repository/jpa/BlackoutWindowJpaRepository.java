package com.remediation.repository.jpa;

import com.remediation.entity.BlackoutWindowEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BlackoutWindowJpaRepository extends JpaRepository<BlackoutWindowEntity, Long> {

    List<BlackoutWindowEntity> findByEnabledTrue();
}

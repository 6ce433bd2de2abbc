package com.remediation.repository.jpa;

import com.remediation.domain.model.BlackoutWindow;
import com.remediation.domain.model.Runbook;
import com.remediation.domain.model.Trigger;
import com.remediation.entity.TriggerEntity;
import com.remediation.mapper.BlackoutWindowMapper;
import com.remediation.mapper.RunbookMapper;
import com.remediation.mapper.TriggerMapper;
import com.remediation.repository.TriggerCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TriggerCatalog} backed by the triggers, runbooks and blackout_windows tables.
 *
 * <p>A trigger whose stored constraints cannot be parsed is left out with a warning so the
 * remaining triggers still match.
 */
@Component
@Transactional(readOnly = true)
public class JpaTriggerCatalog implements TriggerCatalog {

    private static final Logger log = LoggerFactory.getLogger(JpaTriggerCatalog.class);

    private final TriggerJpaRepository triggerJpaRepository;
    private final RunbookJpaRepository runbookJpaRepository;
    private final BlackoutWindowJpaRepository blackoutWindowJpaRepository;
    private final TriggerMapper triggerMapper;
    private final RunbookMapper runbookMapper;
    private final BlackoutWindowMapper blackoutWindowMapper;

    public JpaTriggerCatalog(
            TriggerJpaRepository triggerJpaRepository,
            RunbookJpaRepository runbookJpaRepository,
            BlackoutWindowJpaRepository blackoutWindowJpaRepository,
            TriggerMapper triggerMapper,
            RunbookMapper runbookMapper,
            BlackoutWindowMapper blackoutWindowMapper) {
        this.triggerJpaRepository = triggerJpaRepository;
        this.runbookJpaRepository = runbookJpaRepository;
        this.blackoutWindowJpaRepository = blackoutWindowJpaRepository;
        this.triggerMapper = triggerMapper;
        this.runbookMapper = runbookMapper;
        this.blackoutWindowMapper = blackoutWindowMapper;
    }

    @Override
    public List<Trigger> listEnabledTriggers() {
        List<Trigger> triggers = new ArrayList<>();
        for (TriggerEntity entity : triggerJpaRepository.findByEnabledTrue()) {
            try {
                triggers.add(triggerMapper.toDomain(entity));
            } catch (IllegalStateException e) {
                log.warn("Trigger {} has unreadable constraints, leaving it out: {}", entity.getId(), e.getMessage());
            }
        }
        return triggers;
    }

    @Override
    public Optional<Runbook> getRunbook(Long runbookId) {
        return runbookJpaRepository.findById(runbookId).map(runbookMapper::toDomain);
    }

    @Override
    public List<BlackoutWindow> listEnabledBlackoutWindows() {
        return blackoutWindowMapper.toDomainList(blackoutWindowJpaRepository.findByEnabledTrue());
    }
}

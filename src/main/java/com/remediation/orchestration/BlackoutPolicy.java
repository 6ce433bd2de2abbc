package com.remediation.orchestration;

import com.remediation.domain.model.BlackoutWindow;
import com.remediation.domain.model.Runbook;
import com.remediation.exception.TriggerConfigurationException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a blackout window suppresses a candidate at a given instant.
 *
 * <p>AUTO_ONLY windows only cover candidates that would dispatch without approval; an operator
 * can still be asked to approve during such a window. ALL covers everything, SPECIFIC_RUNBOOKS
 * only the listed runbooks.
 */
@Component
public class BlackoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(BlackoutPolicy.class);

    /**
     * @param autoDispatch whether the candidate would run without an approval step
     * @return the first window suppressing the candidate, if any
     */
    public Optional<BlackoutWindow> findActive(
            List<BlackoutWindow> windows, Runbook runbook, boolean autoDispatch, Instant now) {
        for (BlackoutWindow window : windows) {
            if (!window.isEnabled() || !covers(window, runbook, autoDispatch)) {
                continue;
            }
            try {
                if (isActive(window, now)) {
                    return Optional.of(window);
                }
            } catch (TriggerConfigurationException e) {
                log.warn("Ignoring blackout window {}: {}", window.getId(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    boolean covers(BlackoutWindow window, Runbook runbook, boolean autoDispatch) {
        return switch (window.getAppliesTo()) {
            case ALL -> true;
            case AUTO_ONLY -> autoDispatch;
            case SPECIFIC_RUNBOOKS -> window.getRunbookIds() != null
                    && runbook.getId() != null
                    && window.getRunbookIds().contains(runbook.getId());
        };
    }

    boolean isActive(BlackoutWindow window, Instant now) {
        if (window.getStartTime() != null || window.getEndTime() != null) {
            boolean started = window.getStartTime() == null || !now.isBefore(window.getStartTime());
            boolean notEnded = window.getEndTime() == null || now.isBefore(window.getEndTime());
            return started && notEnded;
        }

        if (window.getDailyStart() == null || window.getDailyEnd() == null) {
            return false;
        }

        ZonedDateTime local;
        try {
            local = now.atZone(ZoneId.of(window.getZoneId()));
        } catch (DateTimeException e) {
            throw new TriggerConfigurationException("Invalid zone '" + window.getZoneId() + "'", e);
        }

        LocalTime time = local.toLocalTime();
        LocalTime start = window.getDailyStart();
        LocalTime end = window.getDailyEnd();

        if (!start.isAfter(end)) {
            return dayMatches(window, local) && !time.isBefore(start) && time.isBefore(end);
        }

        // Spans midnight: the part after midnight belongs to the previous day's window.
        if (!time.isBefore(start)) {
            return dayMatches(window, local);
        }
        return time.isBefore(end) && dayMatches(window, local.minusDays(1));
    }

    private boolean dayMatches(BlackoutWindow window, ZonedDateTime local) {
        return window.getDaysOfWeek() == null
                || window.getDaysOfWeek().isEmpty()
                || window.getDaysOfWeek().contains(local.getDayOfWeek());
    }
}

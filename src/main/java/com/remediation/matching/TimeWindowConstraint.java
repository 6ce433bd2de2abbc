package com.remediation.matching;

import com.remediation.domain.model.Alert;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Restricts matching to alerts received within an hour range and/or on given days.
 *
 * <p>Evaluated against the alert's {@code receivedAt}, never the wall clock, so the result
 * depends only on the alert. {@code startHour} is inclusive, {@code endHour} exclusive; a range
 * with {@code startHour > endHour} spans midnight. Alerts without a timestamp never match.
 */
public record TimeWindowConstraint(Integer startHour, Integer endHour, Set<DayOfWeek> daysOfWeek, String zoneId)
        implements TriggerConstraint {

    @Override
    public boolean isSatisfiedBy(Alert alert, MatchContext context) {
        if (alert.getReceivedAt() == null) {
            return false;
        }
        ZoneId zone = zoneId != null ? ZoneId.of(zoneId) : ZoneId.of("UTC");
        ZonedDateTime receivedAt = alert.getReceivedAt().atZone(zone);

        if (startHour != null && endHour != null && !withinHours(receivedAt.getHour())) {
            return false;
        }
        return daysOfWeek == null || daysOfWeek.isEmpty() || daysOfWeek.contains(receivedAt.getDayOfWeek());
    }

    private boolean withinHours(int hour) {
        if (startHour <= endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }
}

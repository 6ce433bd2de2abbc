package com.remediation.unit.orchestration;

import static org.assertj.core.api.Assertions.assertThat;

import com.remediation.domain.enums.BlackoutScope;
import com.remediation.domain.model.BlackoutWindow;
import com.remediation.domain.model.Runbook;
import com.remediation.orchestration.BlackoutPolicy;
import com.remediation.support.Fixtures;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BlackoutPolicyTest {

    private final BlackoutPolicy blackoutPolicy = new BlackoutPolicy();
    private final Runbook runbook = Fixtures.autoRunbook(1L, "nginx");

    private BlackoutWindow daily(LocalTime start, LocalTime end, BlackoutScope appliesTo) {
        return BlackoutWindow.builder()
                .id(1L)
                .name("nightly-backup")
                .enabled(true)
                .dailyStart(start)
                .dailyEnd(end)
                .zoneId("UTC")
                .appliesTo(appliesTo)
                .build();
    }

    @Nested
    @DisplayName("Time ranges")
    class TimeRanges {

        @Test
        @DisplayName("One-time window covers [start, end)")
        void oneTime() {
            BlackoutWindow window = BlackoutWindow.builder()
                    .id(1L)
                    .name("deploy")
                    .enabled(true)
                    .startTime(Instant.parse("2025-03-10T09:00:00Z"))
                    .endTime(Instant.parse("2025-03-10T10:00:00Z"))
                    .appliesTo(BlackoutScope.ALL)
                    .build();

            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-10T09:30:00Z")))
                    .isPresent();
            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-10T10:00:00Z")))
                    .isEmpty();
        }

        @Test
        @DisplayName("Daily window spanning midnight covers both sides")
        void spansMidnight() {
            BlackoutWindow window = daily(LocalTime.of(23, 0), LocalTime.of(2, 0), BlackoutScope.ALL);

            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-10T23:30:00Z")))
                    .isPresent();
            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-11T01:30:00Z")))
                    .isPresent();
            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-11T03:00:00Z")))
                    .isEmpty();
        }

        @Test
        @DisplayName("Days of week restrict a daily window, after midnight counting as the previous day")
        void daysOfWeek() {
            BlackoutWindow window = daily(LocalTime.of(22, 0), LocalTime.of(4, 0), BlackoutScope.ALL);
            window.setDaysOfWeek(Set.of(DayOfWeek.SATURDAY));

            // Sunday 01:00 belongs to Saturday night
            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-16T01:00:00Z")))
                    .isPresent();
            // Monday 01:00 belongs to Sunday night
            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Instant.parse("2025-03-17T01:00:00Z")))
                    .isEmpty();
        }

        @Test
        @DisplayName("Window with an invalid zone is ignored")
        void invalidZoneIgnored() {
            BlackoutWindow window = daily(LocalTime.MIN, LocalTime.of(23, 59), BlackoutScope.ALL);
            window.setZoneId("Mars/Olympus");

            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, Fixtures.NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Coverage")
    class Coverage {

        private final Instant inside = Instant.parse("2025-03-10T23:30:00Z");

        @Test
        @DisplayName("AUTO_ONLY covers auto-dispatch but not approval candidates")
        void autoOnly() {
            BlackoutWindow window = daily(LocalTime.of(23, 0), LocalTime.of(23, 59), BlackoutScope.AUTO_ONLY);

            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, inside)).isPresent();
            assertThat(blackoutPolicy.findActive(List.of(window), runbook, false, inside)).isEmpty();
        }

        @Test
        @DisplayName("SPECIFIC_RUNBOOKS covers only the listed runbooks")
        void specificRunbooks() {
            BlackoutWindow window = daily(LocalTime.of(23, 0), LocalTime.of(23, 59), BlackoutScope.SPECIFIC_RUNBOOKS);
            window.setRunbookIds(Set.of(2L));

            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, inside)).isEmpty();
            assertThat(blackoutPolicy.findActive(List.of(window), Fixtures.autoRunbook(2L, "cache"), true, inside))
                    .isPresent();
        }

        @Test
        @DisplayName("Disabled windows never apply")
        void disabled() {
            BlackoutWindow window = daily(LocalTime.of(23, 0), LocalTime.of(23, 59), BlackoutScope.ALL);
            window.setEnabled(false);

            assertThat(blackoutPolicy.findActive(List.of(window), runbook, true, inside)).isEmpty();
        }
    }
}

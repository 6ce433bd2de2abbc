package com.remediation.domain.model;

import com.remediation.domain.enums.BlackoutScope;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * Period during which automated remediation is suppressed.
 *
 * <p>Either one-time ({@code startTime}/{@code endTime}) or recurring daily
 * ({@code dailyStart}/{@code dailyEnd} in {@code zoneId}, optionally restricted to
 * {@code daysOfWeek}). A daily range whose end is before its start spans midnight.
 */
@Data
@Builder
public class BlackoutWindow {

    private Long id;
    private String name;
    private boolean enabled;

    private Instant startTime;
    private Instant endTime;

    private LocalTime dailyStart;
    private LocalTime dailyEnd;
    private Set<DayOfWeek> daysOfWeek;

    @Builder.Default
    private String zoneId = "UTC";

    @Builder.Default
    private BlackoutScope appliesTo = BlackoutScope.AUTO_ONLY;

    private Set<Long> runbookIds;
}

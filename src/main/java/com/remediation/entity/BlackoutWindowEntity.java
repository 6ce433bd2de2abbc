package com.remediation.entity;

import com.remediation.domain.enums.BlackoutScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the blackout_windows table. Days of week and runbook ids are JSON arrays.
 */
@Entity
@Table(name = "blackout_windows")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BlackoutWindowEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "daily_start")
    private LocalTime dailyStart;

    @Column(name = "daily_end")
    private LocalTime dailyEnd;

    @Column(name = "days_of_week")
    private String daysOfWeek;

    @Column(name = "zone_id", nullable = false)
    private String zoneId;

    @Enumerated(EnumType.STRING)
    @Column(name = "applies_to", nullable = false, columnDefinition = "varchar(30)")
    private BlackoutScope appliesTo;

    @Column(name = "runbook_ids", columnDefinition = "TEXT")
    private String runbookIds;
}

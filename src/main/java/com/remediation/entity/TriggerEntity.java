package com.remediation.entity;

import com.remediation.domain.enums.ExecutionMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the triggers table. Constraints are stored as a JSON array whose elements carry
 * a {@code kind} discriminator.
 */
@Entity
@Table(name = "triggers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "constraints_json", columnDefinition = "TEXT")
    private String constraints;

    @Column(name = "runbook_id")
    private Long runbookId;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_mode", nullable = false, columnDefinition = "varchar(30)")
    private ExecutionMode executionMode;

    @Column(nullable = false)
    private int priority;
}

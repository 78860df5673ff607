package com.peakrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One rung of a challenge ladder for one division.
 */
@Getter
@Setter
@Entity
@Table(name = "challenge_grades")
public class ChallengeGrade {

    @Id
    @Column(name = "grade_id", nullable = false, updatable = false)
    private UUID gradeId;

    @Column(name = "challenge_id", nullable = false)
    private UUID challengeId;

    @Column(name = "division_id", nullable = false)
    private UUID divisionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 1)
    private Tier tier;

    @Column(name = "target_value", nullable = false, precision = 14, scale = 3)
    private BigDecimal targetValue;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;
}

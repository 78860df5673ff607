package com.peakrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Cumulative XP and derived level for one athlete in one domain.
 * The level is always recomputed from {@code currentXp}; it is never written independently.
 */
@Getter
@Setter
@Entity
@Table(
        name = "domain_progress",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_domain_progress_athlete_domain",
                columnNames = {"athlete_id", "domain_id"}
        )
)
public class DomainProgress {

    @Id
    @Column(name = "progress_id", nullable = false, updatable = false)
    private UUID progressId;

    @Column(name = "athlete_id", nullable = false, updatable = false)
    private UUID athleteId;

    @Column(name = "domain_id", nullable = false, updatable = false)
    private UUID domainId;

    @Column(name = "current_xp", nullable = false)
    private Long currentXp = 0L;

    @Column(name = "level", nullable = false)
    private Integer level = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}

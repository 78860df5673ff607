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

@Getter
@Setter
@Entity
@Table(
        name = "rank_unlocks",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_rank_unlocks_athlete_requirement",
                columnNames = {"athlete_id", "requirement_id"}
        )
)
public class RankUnlock {

    @Id
    @Column(name = "unlock_id", nullable = false, updatable = false)
    private UUID unlockId;

    @Column(name = "athlete_id", nullable = false, updatable = false)
    private UUID athleteId;

    @Column(name = "domain_id", nullable = false, updatable = false)
    private UUID domainId;

    @Column(name = "requirement_id", nullable = false, updatable = false)
    private UUID requirementId;

    @Column(name = "rank_name", nullable = false, length = 64)
    private String rankName;

    @Column(name = "unlocked_at", nullable = false, updatable = false)
    private OffsetDateTime unlockedAt;
}

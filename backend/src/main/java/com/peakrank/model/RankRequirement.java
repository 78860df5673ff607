package com.peakrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A named rank in a domain, unlocked once every {@link RankRequirementItem} is satisfied.
 * A null division applies the requirement to every division.
 */
@Getter
@Setter
@Entity
@Table(name = "rank_requirements")
public class RankRequirement {

    @Id
    @Column(name = "requirement_id", nullable = false, updatable = false)
    private UUID requirementId;

    @Column(name = "domain_id", nullable = false)
    private UUID domainId;

    @Column(name = "division_id")
    private UUID divisionId;

    @Column(name = "rank_name", nullable = false, length = 64)
    private String rankName;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}

package com.peakrank.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "challenges")
public class Challenge {

    @Id
    @Column(name = "challenge_id", nullable = false, updatable = false)
    private UUID challengeId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "grading_type", nullable = false, length = 32)
    private GradingType gradingType;

    @Column(name = "grading_unit", length = 32)
    private String gradingUnit;

    @Enumerated(EnumType.STRING)
    @Column(name = "min_tier", nullable = false, length = 1)
    private Tier minTier = Tier.F;

    @Enumerated(EnumType.STRING)
    @Column(name = "max_tier", nullable = false, length = 1)
    private Tier maxTier = Tier.S;

    @Column(name = "primary_domain_id", nullable = false)
    private UUID primaryDomainId;

    @Column(name = "primary_xp_percent", nullable = false)
    private Integer primaryXpPercent = 100;

    @Column(name = "secondary_domain_id")
    private UUID secondaryDomainId;

    @Column(name = "secondary_xp_percent")
    private Integer secondaryXpPercent;

    @Column(name = "tertiary_domain_id")
    private UUID tertiaryDomainId;

    @Column(name = "tertiary_xp_percent")
    private Integer tertiaryXpPercent;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "challenge_proof_types", joinColumns = @JoinColumn(name = "challenge_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "proof_type", nullable = false, length = 32)
    private Set<ProofType> proofTypes = EnumSet.noneOf(ProofType.class);

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}

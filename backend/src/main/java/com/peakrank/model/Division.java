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
 * Age/gender bracket selecting which grade ladder applies to an athlete.
 * Age bounds are inclusive; a null bound or a null gender matches anything.
 */
@Getter
@Setter
@Entity
@Table(name = "divisions")
public class Division {

    @Id
    @Column(name = "division_id", nullable = false, updatable = false)
    private UUID divisionId;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "gender", length = 64)
    private String gender;

    @Column(name = "age_min")
    private Integer ageMin;

    @Column(name = "age_max")
    private Integer ageMax;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder = 0;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}

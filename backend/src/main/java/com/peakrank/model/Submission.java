package com.peakrank.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "submissions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_submissions_athlete_challenge",
                columnNames = {"athlete_id", "challenge_id"}
        )
)
public class Submission {

    @Id
    @Column(name = "submission_id", nullable = false, updatable = false)
    private UUID submissionId;

    @Column(name = "athlete_id", nullable = false, updatable = false)
    private UUID athleteId;

    @Column(name = "challenge_id", nullable = false, updatable = false)
    private UUID challengeId;

    @Column(name = "submitted_by_user_id", nullable = false)
    private UUID submittedByUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "proof_type", nullable = false, length = 32)
    private ProofType proofType;

    @Column(name = "video_url", length = 2048)
    private String videoUrl;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Column(name = "strava_activity_id", length = 64)
    private String stravaActivityId;

    @Column(name = "garmin_activity_id", length = 64)
    private String garminActivityId;

    @Column(name = "supervisor_id")
    private UUID supervisorId;

    @Column(name = "supervisor_name", length = 120)
    private String supervisorName;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "achieved_value", precision = 14, scale = 3)
    private BigDecimal achievedValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "achieved_tier", length = 1)
    private Tier achievedTier;

    @Convert(converter = TierListConverter.class)
    @Column(name = "claimed_tiers", nullable = false, length = 32)
    private List<Tier> claimedTiers = new ArrayList<>();

    @Column(name = "division_id")
    private UUID divisionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SubmissionStatus status = SubmissionStatus.PENDING;

    @Column(name = "review_notes", columnDefinition = "TEXT")
    private String reviewNotes;

    @Column(name = "reviewed_by_user_id")
    private UUID reviewedByUserId;

    @Column(name = "reviewed_at")
    private OffsetDateTime reviewedAt;

    @Column(name = "xp_awarded", nullable = false)
    private Integer xpAwarded = 0;

    @Column(name = "auto_approved", nullable = false)
    private boolean autoApproved;

    @Column(name = "is_public", nullable = false)
    private boolean publicVisible = true;

    @Column(name = "hide_exact_value", nullable = false)
    private boolean hideExactValue;

    @Column(name = "submitted_at", nullable = false)
    private OffsetDateTime submittedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}

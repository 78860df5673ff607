package com.peakrank.controller.dto;

import com.peakrank.model.ProofType;
import com.peakrank.model.SubmissionStatus;
import com.peakrank.model.Tier;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class SubmissionResponses {

    private SubmissionResponses() {
    }

    public record SubmissionDetail(
            UUID submissionId,
            UUID athleteId,
            UUID challengeId,
            ProofType proofType,
            String videoUrl,
            String imageUrl,
            String stravaActivityId,
            String garminActivityId,
            UUID supervisorId,
            String supervisorName,
            String notes,
            BigDecimal achievedValue,
            boolean valueHidden,
            Tier achievedTier,
            List<Tier> claimedTiers,
            UUID divisionId,
            SubmissionStatus status,
            String reviewNotes,
            UUID reviewedByUserId,
            OffsetDateTime reviewedAt,
            Integer xpAwarded,
            boolean autoApproved,
            boolean isPublic,
            boolean hideExactValue,
            OffsetDateTime submittedAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record SubmissionHistoryEntry(
            UUID historyId,
            Integer version,
            ProofType proofType,
            String videoUrl,
            String imageUrl,
            String notes,
            BigDecimal achievedValue,
            SubmissionStatus status,
            String reviewNotes,
            OffsetDateTime submittedAt,
            OffsetDateTime reviewedAt,
            OffsetDateTime archivedAt
    ) {
    }
}

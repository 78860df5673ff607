package com.peakrank.controller.dto;

import com.peakrank.model.ProofType;
import com.peakrank.model.ReviewDecision;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.UUID;

public final class SubmissionRequests {

    private SubmissionRequests() {
    }

    public record SubmitRequest(
            @NotNull(message = "athleteId is required")
            UUID athleteId,

            @NotNull(message = "challengeId is required")
            UUID challengeId,

            @NotNull(message = "proofType is required")
            ProofType proofType,

            @Size(max = 2048, message = "videoUrl must be at most 2048 characters")
            String videoUrl,

            @Size(max = 2048, message = "imageUrl must be at most 2048 characters")
            String imageUrl,

            @Size(max = 64, message = "stravaActivityId must be at most 64 characters")
            String stravaActivityId,

            @Size(max = 64, message = "garminActivityId must be at most 64 characters")
            String garminActivityId,

            UUID supervisorId,

            @Size(max = 120, message = "supervisorName must be at most 120 characters")
            String supervisorName,

            @Size(max = 2000, message = "notes must be at most 2000 characters")
            String notes,

            @Digits(integer = 11, fraction = 3, message = "achievedValue supports up to 3 decimal places")
            BigDecimal achievedValue,

            Boolean isPublic,

            Boolean hideExactValue
    ) {
    }

    public record ReviewRequest(
            @NotNull(message = "decision is required")
            ReviewDecision decision,

            @Digits(integer = 11, fraction = 3, message = "achievedValue supports up to 3 decimal places")
            BigDecimal achievedValue,

            @Size(max = 2000, message = "reviewNotes must be at most 2000 characters")
            String reviewNotes
    ) {
    }

    public record AdjustXpRequest(
            @NotNull(message = "domainId is required")
            UUID domainId,

            @NotNull(message = "amount is required")
            Long amount,

            @NotBlank(message = "note is required")
            @Size(max = 500, message = "note must be at most 500 characters")
            String note
    ) {
    }
}

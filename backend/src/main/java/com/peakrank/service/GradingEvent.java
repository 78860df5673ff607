package com.peakrank.service;

import com.peakrank.model.Tier;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Payload handed to notification sinks. Fields that do not apply to the event type are null.
 */
public record GradingEvent(
        Type type,
        UUID athleteId,
        UUID submissionId,
        UUID challengeId,
        Tier achievedTier,
        Integer xpAwarded,
        UUID domainId,
        String rankName,
        String notes,
        OffsetDateTime occurredAt
) {

    public enum Type {
        SUBMISSION_APPROVED,
        SUBMISSION_REJECTED,
        SUBMISSION_NEEDS_REVISION,
        RANK_UNLOCKED
    }
}

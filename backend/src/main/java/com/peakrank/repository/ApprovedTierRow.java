package com.peakrank.repository;

import com.peakrank.model.Tier;

import java.util.UUID;

public record ApprovedTierRow(
        UUID submissionId,
        UUID challengeId,
        Tier achievedTier
) {
}

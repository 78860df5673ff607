package com.peakrank.controller.dto;

import com.peakrank.model.Tier;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class ProgressionResponses {

    private ProgressionResponses() {
    }

    public record AthleteProgression(
            UUID athleteId,
            List<DomainProgressView> domains,
            List<UnlockedRank> ranks
    ) {
    }

    public record DomainProgressView(
            UUID domainId,
            long currentXp,
            int level,
            Tier levelTier,
            int sublevel,
            String levelLabel,
            Long xpToNextLevel,
            OffsetDateTime updatedAt
    ) {
    }

    public record UnlockedRank(
            UUID requirementId,
            UUID domainId,
            String rankName,
            OffsetDateTime unlockedAt
    ) {
    }

    public record ProgressionUpdate(
            UUID athleteId,
            UUID domainId,
            long previousXp,
            long newXp,
            int previousLevel,
            int newLevel,
            List<RankUpdate> rankChanges
    ) {
    }

    public record RankUpdate(
            UUID requirementId,
            String rankName,
            boolean unlocked
    ) {
    }
}

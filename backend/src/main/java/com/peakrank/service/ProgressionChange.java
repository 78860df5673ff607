package com.peakrank.service;

import java.util.List;
import java.util.UUID;

public record ProgressionChange(
        UUID athleteId,
        UUID domainId,
        long previousXp,
        long newXp,
        int previousLevel,
        int newLevel,
        List<RankChange> rankChanges
) {

    public ProgressionChange {
        rankChanges = rankChanges == null ? List.of() : List.copyOf(rankChanges);
    }

    public long delta() {
        return newXp - previousXp;
    }
}

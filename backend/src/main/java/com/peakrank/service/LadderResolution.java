package com.peakrank.service;

import com.peakrank.model.Tier;

import java.util.List;

/**
 * Outcome of resolving an achieved value against a tier ladder.
 * {@code claimedTiers} is the satisfied prefix, easiest first; {@code highestTier} is its last element.
 */
public record LadderResolution(Tier highestTier, List<Tier> claimedTiers, boolean graded) {

    private static final LadderResolution UNGRADED = new LadderResolution(null, List.of(), false);

    public LadderResolution {
        claimedTiers = claimedTiers == null ? List.of() : List.copyOf(claimedTiers);
    }

    public static LadderResolution ungraded() {
        return UNGRADED;
    }

    public boolean hasTier() {
        return highestTier != null;
    }
}

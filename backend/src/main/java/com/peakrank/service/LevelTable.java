package com.peakrank.service;

import com.peakrank.config.ProgressionProperties;
import com.peakrank.model.Tier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cumulative XP cutoffs, index = level. Level for an XP total is the greatest index whose cutoff does not exceed it.
 */
@Component
public class LevelTable {

    static final int SUBLEVELS_PER_TIER = 10;
    static final int MAX_LEVELS = Tier.values().length * SUBLEVELS_PER_TIER;

    private final long[] thresholds;

    public LevelTable(ProgressionProperties progressionProperties) {
        this.thresholds = resolveThresholds(progressionProperties);
    }

    public int levelFor(long xp) {
        if (xp < 0) {
            throw new IllegalArgumentException("xp must be non-negative, got " + xp);
        }
        int low = 0;
        int high = thresholds.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (thresholds[mid] <= xp) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    public long thresholdFor(int level) {
        if (level < 0 || level >= thresholds.length) {
            throw new IllegalArgumentException("level out of range: " + level);
        }
        return thresholds[level];
    }

    public int maxLevel() {
        return thresholds.length - 1;
    }

    /**
     * XP still needed to reach the next level, or {@code null} at the top of the table.
     */
    public Long xpToNextLevel(long xp) {
        int level = levelFor(xp);
        if (level >= maxLevel()) {
            return null;
        }
        return thresholds[level + 1] - xp;
    }

    public static Tier tierOf(int level) {
        return Tier.forLevel(level);
    }

    public static int sublevelOf(int level) {
        return level - tierOf(level).ordinal() * SUBLEVELS_PER_TIER;
    }

    public static String displayOf(int level) {
        return tierOf(level).name() + sublevelOf(level);
    }

    private static long[] resolveThresholds(ProgressionProperties properties) {
        List<Long> configured = properties.getLevelThresholds();
        if (configured != null && !configured.isEmpty()) {
            return validated(configured);
        }
        return validated(derive(properties.getXpPerSublevel()));
    }

    private static List<Long> derive(Map<Tier, Integer> xpPerSublevel) {
        if (xpPerSublevel == null) {
            throw new IllegalStateException("peakrank.progression.xp-per-sublevel is required");
        }
        List<Long> derived = new ArrayList<>();
        long cumulative = 0;
        for (Tier tier : Tier.values()) {
            Integer cost = xpPerSublevel.get(tier);
            if (cost == null || cost <= 0) {
                throw new IllegalStateException(
                        "peakrank.progression.xp-per-sublevel must define a positive value for tier " + tier);
            }
            for (int sublevel = 0; sublevel < SUBLEVELS_PER_TIER; sublevel++) {
                derived.add(cumulative);
                cumulative += cost;
            }
        }
        return derived;
    }

    private static long[] validated(List<Long> cutoffs) {
        if (cutoffs.size() > MAX_LEVELS) {
            throw new IllegalStateException(
                    "At most " + MAX_LEVELS + " level thresholds are supported, got " + cutoffs.size());
        }
        long[] result = new long[cutoffs.size()];
        for (int i = 0; i < cutoffs.size(); i++) {
            Long cutoff = cutoffs.get(i);
            if (cutoff == null) {
                throw new IllegalStateException("Level threshold " + i + " is null");
            }
            if (i == 0 && cutoff != 0L) {
                throw new IllegalStateException("Level thresholds must start at 0, got " + cutoff);
            }
            if (i > 0 && cutoff <= result[i - 1]) {
                throw new IllegalStateException(
                        "Level thresholds must be strictly increasing: " + result[i - 1] + " then " + cutoff);
            }
            result[i] = cutoff;
        }
        return result;
    }
}

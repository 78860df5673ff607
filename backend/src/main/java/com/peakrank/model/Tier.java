package com.peakrank.model;

/**
 * Tier letters of a challenge ladder, easiest first.
 * Declaration order is the difficulty order; level numbers map onto it in blocks of ten.
 */
public enum Tier {
    F,
    E,
    D,
    C,
    B,
    A,
    S;

    public boolean isAtLeast(Tier other) {
        return compareTo(other) >= 0;
    }

    public static Tier forLevel(int level) {
        Tier[] tiers = values();
        int index = Math.max(0, Math.min(tiers.length - 1, level / 10));
        return tiers[index];
    }
}

package com.peakrank.config;

import com.peakrank.model.Tier;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Submission review and XP award settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "peakrank.grading")
public class GradingProperties {

    /**
     * Approve submissions created by coaches and admins in the same transaction.
     */
    private boolean autoApprovePrivileged = true;

    /**
     * XP granted for each claimed tier of an approved submission.
     */
    private Map<Tier, Integer> tierXp = defaultTierXp();

    public int xpForTier(Tier tier) {
        Integer value = tierXp.get(tier);
        if (value == null) {
            throw new IllegalStateException("peakrank.grading.tier-xp has no entry for tier " + tier);
        }
        return value;
    }

    private static Map<Tier, Integer> defaultTierXp() {
        Map<Tier, Integer> defaults = new EnumMap<>(Tier.class);
        defaults.put(Tier.F, 25);
        defaults.put(Tier.E, 50);
        defaults.put(Tier.D, 75);
        defaults.put(Tier.C, 100);
        defaults.put(Tier.B, 150);
        defaults.put(Tier.A, 200);
        defaults.put(Tier.S, 300);
        return defaults;
    }
}

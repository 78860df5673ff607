package com.peakrank.service;

import com.peakrank.config.GradingProperties;
import com.peakrank.model.Challenge;
import com.peakrank.model.GradingType;
import com.peakrank.model.Tier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a ladder resolution into XP and splits it across the challenge's domains.
 */
@Component
@RequiredArgsConstructor
public class XpAwardCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final GradingProperties gradingProperties;

    /**
     * Sum of per-tier XP over the claimed tiers. Pass/fail challenges award the rounded mean of
     * their min and max tier XP; any other ungraded result awards nothing.
     */
    public int baseXp(LadderResolution resolution, Challenge challenge) {
        if (challenge.getGradingType() == GradingType.PASS_FAIL) {
            Tier minTier = challenge.getMinTier() == null ? Tier.F : challenge.getMinTier();
            Tier maxTier = challenge.getMaxTier() == null ? Tier.S : challenge.getMaxTier();
            int total = gradingProperties.xpForTier(minTier) + gradingProperties.xpForTier(maxTier);
            return BigDecimal.valueOf(total)
                    .divide(BigDecimal.valueOf(2), 0, RoundingMode.HALF_UP)
                    .intValueExact();
        }
        if (resolution == null || !resolution.graded()) {
            return 0;
        }
        return resolution.claimedTiers().stream()
                .mapToInt(gradingProperties::xpForTier)
                .sum();
    }

    /**
     * Per-domain share of {@code baseXp}, primary domain first. Zero shares are omitted.
     */
    public Map<UUID, Integer> distribute(int baseXp, Challenge challenge) {
        Map<UUID, Integer> shares = new LinkedHashMap<>();
        if (baseXp <= 0) {
            return shares;
        }
        Integer primaryPercent = challenge.getPrimaryXpPercent() == null ? 100 : challenge.getPrimaryXpPercent();
        addShare(shares, challenge.getPrimaryDomainId(), primaryPercent, baseXp);
        addShare(shares, challenge.getSecondaryDomainId(), challenge.getSecondaryXpPercent(), baseXp);
        addShare(shares, challenge.getTertiaryDomainId(), challenge.getTertiaryXpPercent(), baseXp);
        return shares;
    }

    private static void addShare(Map<UUID, Integer> shares, UUID domainId, Integer percent, int baseXp) {
        if (domainId == null || percent == null || percent <= 0) {
            return;
        }
        int share = BigDecimal.valueOf(baseXp)
                .multiply(BigDecimal.valueOf(percent))
                .divide(HUNDRED, 0, RoundingMode.HALF_UP)
                .intValueExact();
        if (share > 0) {
            shares.merge(domainId, share, Integer::sum);
        }
    }
}

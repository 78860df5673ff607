package com.peakrank.service;

import com.peakrank.config.GradingProperties;
import com.peakrank.model.Challenge;
import com.peakrank.model.GradingType;
import com.peakrank.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XpAwardCalculatorTest {

    private static final UUID STRENGTH = UUID.fromString("00000000-0000-0000-0000-00000000d001");
    private static final UUID ENDURANCE = UUID.fromString("00000000-0000-0000-0000-00000000d002");
    private static final UUID MOBILITY = UUID.fromString("00000000-0000-0000-0000-00000000d003");

    private final XpAwardCalculator calculator = new XpAwardCalculator(new GradingProperties());

    @Test
    void baseXpSumsEveryClaimedTier() {
        LadderResolution resolution = new LadderResolution(Tier.D, List.of(Tier.F, Tier.E, Tier.D), true);

        assertEquals(25 + 50 + 75, calculator.baseXp(resolution, challenge(GradingType.REPS)));
    }

    @Test
    void ungradedResultEarnsNothingUnlessPassFail() {
        assertEquals(0, calculator.baseXp(LadderResolution.ungraded(), challenge(GradingType.TIME)));
        assertEquals(0, calculator.baseXp(new LadderResolution(null, List.of(), true), challenge(GradingType.TIME)));
    }

    @Test
    void passFailEarnsRoundedMeanOfTierRange() {
        Challenge challenge = challenge(GradingType.PASS_FAIL);
        challenge.setMinTier(Tier.F);
        challenge.setMaxTier(Tier.E);

        // (25 + 50) / 2 = 37.5
        assertEquals(38, calculator.baseXp(LadderResolution.ungraded(), challenge));
    }

    @Test
    void distributeSplitsByPercentWithHalfUpRounding() {
        Challenge challenge = challenge(GradingType.REPS);
        challenge.setPrimaryXpPercent(60);
        challenge.setSecondaryDomainId(ENDURANCE);
        challenge.setSecondaryXpPercent(25);
        challenge.setTertiaryDomainId(MOBILITY);
        challenge.setTertiaryXpPercent(15);

        Map<UUID, Integer> shares = calculator.distribute(75, challenge);

        assertEquals(List.of(STRENGTH, ENDURANCE, MOBILITY), List.copyOf(shares.keySet()));
        assertEquals(45, shares.get(STRENGTH));
        assertEquals(19, shares.get(ENDURANCE));
        assertEquals(11, shares.get(MOBILITY));
    }

    @Test
    void distributeGivesEverythingToPrimaryByDefault() {
        assertEquals(Map.of(STRENGTH, 150), calculator.distribute(150, challenge(GradingType.WEIGHTED_REPS)));
        assertTrue(calculator.distribute(0, challenge(GradingType.WEIGHTED_REPS)).isEmpty());
    }

    private static Challenge challenge(GradingType gradingType) {
        Challenge challenge = new Challenge();
        challenge.setChallengeId(UUID.randomUUID());
        challenge.setName("Test challenge");
        challenge.setGradingType(gradingType);
        challenge.setPrimaryDomainId(STRENGTH);
        return challenge;
    }
}

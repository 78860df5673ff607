package com.peakrank.service;

import com.peakrank.model.ChallengeGrade;
import com.peakrank.model.GradingDirection;
import com.peakrank.model.GradingType;
import com.peakrank.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Resolves an achieved value against a division's tier ladder.
 * <p>
 * The ladder is ordered easiest first: descending target for lower-is-better metrics, ascending
 * target for higher-is-better ones, tier letter breaking equal targets. Scanning stops at the first
 * unsatisfied rung, so the claimed tiers always form a prefix of the ladder.
 */
@Component
public class GradeLadderResolver {

    private static final Logger log = LoggerFactory.getLogger(GradeLadderResolver.class);

    public LadderResolution resolveForDivision(
            BigDecimal achievedValue,
            Collection<ChallengeGrade> grades,
            UUID divisionId,
            GradingType gradingType
    ) {
        if (divisionId == null || grades == null) {
            return LadderResolution.ungraded();
        }
        List<ChallengeGrade> divisionGrades = grades.stream()
                .filter(grade -> divisionId.equals(grade.getDivisionId()))
                .toList();
        return resolve(achievedValue, divisionGrades, gradingType);
    }

    public LadderResolution resolve(BigDecimal achievedValue, Collection<ChallengeGrade> grades, GradingType gradingType) {
        Objects.requireNonNull(gradingType, "gradingType is required");
        GradingDirection direction = gradingType.direction();
        if (direction == GradingDirection.UNGRADED || grades == null || grades.isEmpty() || achievedValue == null) {
            return LadderResolution.ungraded();
        }

        List<ChallengeGrade> ladder = grades.stream()
                .filter(grade -> grade.getTier() != null && grade.getTargetValue() != null)
                .sorted(easiestFirst(direction))
                .toList();
        if (ladder.isEmpty()) {
            return LadderResolution.ungraded();
        }

        List<Tier> claimed = new ArrayList<>();
        for (ChallengeGrade grade : ladder) {
            if (!isSatisfied(direction, achievedValue, grade.getTargetValue())) {
                break;
            }
            if (!claimed.contains(grade.getTier())) {
                claimed.add(grade.getTier());
            }
        }

        Tier highest = claimed.isEmpty() ? null : claimed.get(claimed.size() - 1);
        log.debug("Resolved value {} against {} rungs ({}): claimed {}", achievedValue, ladder.size(), direction, claimed);
        return new LadderResolution(highest, claimed, true);
    }

    static boolean isSatisfied(GradingDirection direction, BigDecimal achievedValue, BigDecimal targetValue) {
        return switch (direction) {
            case LOWER_IS_BETTER -> achievedValue.compareTo(targetValue) <= 0;
            case HIGHER_IS_BETTER -> achievedValue.compareTo(targetValue) >= 0;
            case UNGRADED -> false;
        };
    }

    private static Comparator<ChallengeGrade> easiestFirst(GradingDirection direction) {
        Comparator<ChallengeGrade> byTarget = Comparator.comparing(ChallengeGrade::getTargetValue);
        if (direction == GradingDirection.LOWER_IS_BETTER) {
            byTarget = byTarget.reversed();
        }
        return byTarget.thenComparing(ChallengeGrade::getTier);
    }
}

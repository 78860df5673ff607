package com.peakrank.service;

import com.peakrank.model.RankRequirement;
import com.peakrank.model.RankRequirementItem;
import com.peakrank.model.RankUnlock;
import com.peakrank.model.SubmissionStatus;
import com.peakrank.model.Tier;
import com.peakrank.repository.ApprovedTierRow;
import com.peakrank.repository.RankRequirementItemRepository;
import com.peakrank.repository.RankRequirementRepository;
import com.peakrank.repository.RankUnlockRepository;
import com.peakrank.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Re-evaluates the rank requirements of one domain against the athlete's approved submissions.
 * <p>
 * A requirement is met when every item has an approved submission at or above its minimum tier.
 * Requirements without items never unlock. Existing unlocks are only removed when the caller allows
 * revocation, which is limited to the reversal path.
 */
@Service
@RequiredArgsConstructor
public class RankUnlockEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RankUnlockEvaluator.class);

    private final RankRequirementRepository rankRequirementRepository;
    private final RankRequirementItemRepository rankRequirementItemRepository;
    private final RankUnlockRepository rankUnlockRepository;
    private final SubmissionRepository submissionRepository;
    private final GradingNotificationPublisher gradingNotificationPublisher;

    public List<RankChange> evaluate(
            UUID athleteId,
            UUID domainId,
            UUID divisionId,
            boolean allowRevocation,
            UUID excludedSubmissionId,
            OffsetDateTime now
    ) {
        List<RankRequirement> requirements = rankRequirementRepository.findApplicable(domainId, divisionId);
        if (requirements.isEmpty()) {
            return List.of();
        }

        Map<UUID, RankUnlock> unlocksByRequirement = rankUnlockRepository.findByAthleteIdAndDomainId(athleteId, domainId)
                .stream()
                .collect(Collectors.toMap(RankUnlock::getRequirementId, Function.identity(), (first, second) -> first));

        Map<UUID, List<RankRequirementItem>> itemsByRequirement = rankRequirementItemRepository
                .findByRequirementIdIn(requirements.stream().map(RankRequirement::getRequirementId).toList())
                .stream()
                .collect(Collectors.groupingBy(RankRequirementItem::getRequirementId));

        Map<UUID, Tier> bestTierByChallenge = bestApprovedTiers(athleteId, itemsByRequirement, excludedSubmissionId);

        List<RankChange> changes = new ArrayList<>();
        for (RankRequirement requirement : requirements) {
            List<RankRequirementItem> items = itemsByRequirement.getOrDefault(requirement.getRequirementId(), List.of());
            boolean satisfied = isSatisfied(items, bestTierByChallenge);
            RankUnlock existing = unlocksByRequirement.get(requirement.getRequirementId());

            if (satisfied && existing == null) {
                RankUnlock unlock = new RankUnlock();
                unlock.setUnlockId(UUID.randomUUID());
                unlock.setAthleteId(athleteId);
                unlock.setDomainId(domainId);
                unlock.setRequirementId(requirement.getRequirementId());
                unlock.setRankName(requirement.getRankName());
                unlock.setUnlockedAt(now);
                rankUnlockRepository.save(unlock);
                gradingNotificationPublisher.rankUnlocked(athleteId, domainId, requirement.getRankName(), now);
                log.info("Athlete {} unlocked rank '{}' in domain {}", athleteId, requirement.getRankName(), domainId);
                changes.add(new RankChange(requirement.getRequirementId(), domainId, requirement.getRankName(), true));
            } else if (!satisfied && existing != null && allowRevocation) {
                rankUnlockRepository.delete(existing);
                log.info("Athlete {} lost rank '{}' in domain {}", athleteId, requirement.getRankName(), domainId);
                changes.add(new RankChange(requirement.getRequirementId(), domainId, requirement.getRankName(), false));
            }
        }
        return changes;
    }

    static boolean isSatisfied(List<RankRequirementItem> items, Map<UUID, Tier> bestTierByChallenge) {
        if (items.isEmpty()) {
            return false;
        }
        for (RankRequirementItem item : items) {
            Tier best = bestTierByChallenge.get(item.getChallengeId());
            Tier minimum = item.getMinimumTier() == null ? Tier.F : item.getMinimumTier();
            if (best == null || !best.isAtLeast(minimum)) {
                return false;
            }
        }
        return true;
    }

    private Map<UUID, Tier> bestApprovedTiers(
            UUID athleteId,
            Map<UUID, List<RankRequirementItem>> itemsByRequirement,
            UUID excludedSubmissionId
    ) {
        List<UUID> challengeIds = itemsByRequirement.values().stream()
                .flatMap(List::stream)
                .map(RankRequirementItem::getChallengeId)
                .distinct()
                .toList();
        if (challengeIds.isEmpty()) {
            return Map.of();
        }

        Map<UUID, Tier> best = new HashMap<>();
        for (ApprovedTierRow row : submissionRepository.findTierRows(athleteId, SubmissionStatus.APPROVED, challengeIds)) {
            if (row.submissionId().equals(excludedSubmissionId)) {
                continue;
            }
            best.merge(row.challengeId(), row.achievedTier(), (left, right) -> left.isAtLeast(right) ? left : right);
        }
        return best;
    }
}

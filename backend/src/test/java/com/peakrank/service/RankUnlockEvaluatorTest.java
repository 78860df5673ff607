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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RankUnlockEvaluatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 6, 15, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final UUID ATHLETE_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID DOMAIN_ID = UUID.fromString("00000000-0000-0000-0000-00000000d001");
    private static final UUID DIVISION_ID = UUID.fromString("00000000-0000-0000-0000-000000000201");
    private static final UUID REQUIREMENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000e001");
    private static final UUID PULL_UPS = UUID.fromString("00000000-0000-0000-0000-00000000c001");
    private static final UUID DEADLIFT = UUID.fromString("00000000-0000-0000-0000-00000000c002");

    @Mock
    private RankRequirementRepository rankRequirementRepository;

    @Mock
    private RankRequirementItemRepository rankRequirementItemRepository;

    @Mock
    private RankUnlockRepository rankUnlockRepository;

    @Mock
    private SubmissionRepository submissionRepository;

    @Mock
    private GradingNotificationPublisher gradingNotificationPublisher;

    @InjectMocks
    private RankUnlockEvaluator rankUnlockEvaluator;

    @Test
    void unlocksWhenEveryItemMeetsItsMinimumTier() {
        stubRequirement(List.of());
        when(submissionRepository.findTierRows(eq(ATHLETE_ID), eq(SubmissionStatus.APPROVED), anyList())).thenReturn(List.of(
                new ApprovedTierRow(UUID.randomUUID(), PULL_UPS, Tier.D),
                new ApprovedTierRow(UUID.randomUUID(), DEADLIFT, Tier.C)
        ));

        List<RankChange> changes =
                rankUnlockEvaluator.evaluate(ATHLETE_ID, DOMAIN_ID, DIVISION_ID, false, null, NOW);

        assertEquals(List.of(new RankChange(REQUIREMENT_ID, DOMAIN_ID, "Iron", true)), changes);
        ArgumentCaptor<RankUnlock> captor = ArgumentCaptor.forClass(RankUnlock.class);
        verify(rankUnlockRepository).save(captor.capture());
        assertEquals(ATHLETE_ID, captor.getValue().getAthleteId());
        assertEquals(REQUIREMENT_ID, captor.getValue().getRequirementId());
        assertEquals(NOW, captor.getValue().getUnlockedAt());
        verify(gradingNotificationPublisher).rankUnlocked(ATHLETE_ID, DOMAIN_ID, "Iron", NOW);
    }

    @Test
    void staysLockedWhileOneItemIsBelowMinimum() {
        stubRequirement(List.of());
        when(submissionRepository.findTierRows(eq(ATHLETE_ID), eq(SubmissionStatus.APPROVED), anyList())).thenReturn(List.of(
                new ApprovedTierRow(UUID.randomUUID(), PULL_UPS, Tier.E),
                new ApprovedTierRow(UUID.randomUUID(), DEADLIFT, Tier.S)
        ));

        assertTrue(rankUnlockEvaluator.evaluate(ATHLETE_ID, DOMAIN_ID, DIVISION_ID, false, null, NOW).isEmpty());
        verify(rankUnlockRepository, never()).save(any());
        verifyNoInteractions(gradingNotificationPublisher);
    }

    @Test
    void revokesOnlyWhenRevocationIsAllowed() {
        UUID removedSubmission = UUID.randomUUID();
        RankUnlock existing = unlock();
        stubRequirement(List.of(existing));
        when(submissionRepository.findTierRows(eq(ATHLETE_ID), eq(SubmissionStatus.APPROVED), anyList())).thenReturn(List.of(
                new ApprovedTierRow(removedSubmission, PULL_UPS, Tier.D),
                new ApprovedTierRow(UUID.randomUUID(), DEADLIFT, Tier.C)
        ));

        List<RankChange> kept =
                rankUnlockEvaluator.evaluate(ATHLETE_ID, DOMAIN_ID, DIVISION_ID, false, removedSubmission, NOW);
        assertTrue(kept.isEmpty());
        verify(rankUnlockRepository, never()).delete(any());

        List<RankChange> revoked =
                rankUnlockEvaluator.evaluate(ATHLETE_ID, DOMAIN_ID, DIVISION_ID, true, removedSubmission, NOW);
        assertEquals(1, revoked.size());
        assertFalse(revoked.get(0).unlocked());
        verify(rankUnlockRepository).delete(existing);
    }

    @Test
    void requirementWithoutItemsNeverUnlocks() {
        when(rankRequirementRepository.findApplicable(DOMAIN_ID, DIVISION_ID)).thenReturn(List.of(requirement()));
        when(rankUnlockRepository.findByAthleteIdAndDomainId(ATHLETE_ID, DOMAIN_ID)).thenReturn(List.of());
        when(rankRequirementItemRepository.findByRequirementIdIn(List.of(REQUIREMENT_ID))).thenReturn(List.of());

        assertTrue(rankUnlockEvaluator.evaluate(ATHLETE_ID, DOMAIN_ID, DIVISION_ID, false, null, NOW).isEmpty());
        verifyNoInteractions(submissionRepository);
    }

    @Test
    void noApplicableRequirementsIsANoOp() {
        when(rankRequirementRepository.findApplicable(DOMAIN_ID, null)).thenReturn(List.of());

        assertTrue(rankUnlockEvaluator.evaluate(ATHLETE_ID, DOMAIN_ID, null, true, null, NOW).isEmpty());
        verifyNoInteractions(rankUnlockRepository, submissionRepository);
    }

    private void stubRequirement(List<RankUnlock> existingUnlocks) {
        when(rankRequirementRepository.findApplicable(DOMAIN_ID, DIVISION_ID)).thenReturn(List.of(requirement()));
        when(rankUnlockRepository.findByAthleteIdAndDomainId(ATHLETE_ID, DOMAIN_ID)).thenReturn(existingUnlocks);
        when(rankRequirementItemRepository.findByRequirementIdIn(List.of(REQUIREMENT_ID))).thenReturn(List.of(
                item(PULL_UPS, Tier.D),
                item(DEADLIFT, Tier.C)
        ));
    }

    private static RankRequirement requirement() {
        RankRequirement requirement = new RankRequirement();
        requirement.setRequirementId(REQUIREMENT_ID);
        requirement.setDomainId(DOMAIN_ID);
        requirement.setRankName("Iron");
        requirement.setActive(true);
        requirement.setCreatedAt(NOW.minusDays(30));
        return requirement;
    }

    private static RankRequirementItem item(UUID challengeId, Tier minimumTier) {
        RankRequirementItem item = new RankRequirementItem();
        item.setItemId(UUID.randomUUID());
        item.setRequirementId(REQUIREMENT_ID);
        item.setChallengeId(challengeId);
        item.setMinimumTier(minimumTier);
        return item;
    }

    private static RankUnlock unlock() {
        RankUnlock unlock = new RankUnlock();
        unlock.setUnlockId(UUID.randomUUID());
        unlock.setAthleteId(ATHLETE_ID);
        unlock.setDomainId(DOMAIN_ID);
        unlock.setRequirementId(REQUIREMENT_ID);
        unlock.setRankName("Iron");
        unlock.setUnlockedAt(NOW.minusDays(1));
        return unlock;
    }
}

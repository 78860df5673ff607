package com.peakrank.mapper;

import com.peakrank.controller.dto.ProgressionResponses;
import com.peakrank.controller.dto.SubmissionResponses;
import com.peakrank.model.DomainProgress;
import com.peakrank.model.RankUnlock;
import com.peakrank.model.Submission;
import com.peakrank.model.SubmissionHistory;
import com.peakrank.service.LevelTable;
import com.peakrank.service.ProgressionChange;
import com.peakrank.service.RankChange;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Component
public class GradingResponseMapper {

    /**
     * @param maskValue blank out the achieved value for viewers who may not see it
     */
    public SubmissionResponses.SubmissionDetail toSubmissionDetail(Submission submission, boolean maskValue) {
        return new SubmissionResponses.SubmissionDetail(
                submission.getSubmissionId(),
                submission.getAthleteId(),
                submission.getChallengeId(),
                submission.getProofType(),
                submission.getVideoUrl(),
                submission.getImageUrl(),
                submission.getStravaActivityId(),
                submission.getGarminActivityId(),
                submission.getSupervisorId(),
                submission.getSupervisorName(),
                submission.getNotes(),
                maskValue ? null : submission.getAchievedValue(),
                maskValue,
                submission.getAchievedTier(),
                submission.getClaimedTiers() == null ? List.of() : List.copyOf(submission.getClaimedTiers()),
                submission.getDivisionId(),
                submission.getStatus(),
                submission.getReviewNotes(),
                submission.getReviewedByUserId(),
                submission.getReviewedAt(),
                submission.getXpAwarded(),
                submission.isAutoApproved(),
                submission.isPublicVisible(),
                submission.isHideExactValue(),
                submission.getSubmittedAt(),
                submission.getUpdatedAt()
        );
    }

    public List<SubmissionResponses.SubmissionHistoryEntry> toHistoryEntries(Collection<SubmissionHistory> history) {
        return history.stream()
                .map(entry -> new SubmissionResponses.SubmissionHistoryEntry(
                        entry.getHistoryId(),
                        entry.getVersion(),
                        entry.getProofType(),
                        entry.getVideoUrl(),
                        entry.getImageUrl(),
                        entry.getNotes(),
                        entry.getAchievedValue(),
                        entry.getStatus(),
                        entry.getReviewNotes(),
                        entry.getSubmittedAt(),
                        entry.getReviewedAt(),
                        entry.getArchivedAt()
                ))
                .toList();
    }

    public ProgressionResponses.DomainProgressView toDomainProgressView(DomainProgress progress, LevelTable levelTable) {
        long xp = progress.getCurrentXp() == null ? 0L : progress.getCurrentXp();
        int level = progress.getLevel() == null ? 0 : progress.getLevel();
        return new ProgressionResponses.DomainProgressView(
                progress.getDomainId(),
                xp,
                level,
                LevelTable.tierOf(level),
                LevelTable.sublevelOf(level),
                LevelTable.displayOf(level),
                levelTable.xpToNextLevel(xp),
                progress.getUpdatedAt()
        );
    }

    public ProgressionResponses.UnlockedRank toUnlockedRank(RankUnlock unlock) {
        return new ProgressionResponses.UnlockedRank(
                unlock.getRequirementId(),
                unlock.getDomainId(),
                unlock.getRankName(),
                unlock.getUnlockedAt()
        );
    }

    public ProgressionResponses.AthleteProgression toAthleteProgression(
            UUID athleteId,
            List<ProgressionResponses.DomainProgressView> domains,
            Collection<RankUnlock> unlocks
    ) {
        return new ProgressionResponses.AthleteProgression(
                athleteId,
                domains,
                unlocks.stream().map(this::toUnlockedRank).toList()
        );
    }

    public ProgressionResponses.ProgressionUpdate toProgressionUpdate(ProgressionChange change) {
        return new ProgressionResponses.ProgressionUpdate(
                change.athleteId(),
                change.domainId(),
                change.previousXp(),
                change.newXp(),
                change.previousLevel(),
                change.newLevel(),
                change.rankChanges().stream().map(this::toRankUpdate).toList()
        );
    }

    private ProgressionResponses.RankUpdate toRankUpdate(RankChange change) {
        return new ProgressionResponses.RankUpdate(change.requirementId(), change.rankName(), change.unlocked());
    }
}

package com.peakrank.service;

import com.peakrank.config.GradingProperties;
import com.peakrank.controller.dto.SubmissionRequests;
import com.peakrank.controller.dto.SubmissionResponses;
import com.peakrank.mapper.GradingResponseMapper;
import com.peakrank.model.Athlete;
import com.peakrank.model.Challenge;
import com.peakrank.model.ChallengeGrade;
import com.peakrank.model.Division;
import com.peakrank.model.GradingDirection;
import com.peakrank.model.Submission;
import com.peakrank.model.SubmissionHistory;
import com.peakrank.model.SubmissionStatus;
import com.peakrank.model.XpSource;
import com.peakrank.repository.AthleteRepository;
import com.peakrank.repository.ChallengeGradeRepository;
import com.peakrank.repository.ChallengeRepository;
import com.peakrank.repository.SubmissionHistoryRepository;
import com.peakrank.repository.SubmissionRepository;
import com.peakrank.web.GradingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Submission state machine.
 * <pre>
 * PENDING -> APPROVED | REJECTED | NEEDS_REVISION
 * NEEDS_REVISION -> PENDING (resubmission)
 * APPROVED | REJECTED -> PENDING (admin reopen)
 * </pre>
 * Every transition runs in one transaction with the submission row locked, so concurrent reviews of the
 * same submission serialize and the loser observes the committed state.
 */
@Service
@RequiredArgsConstructor
public class SubmissionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionLifecycleService.class);

    private final SubmissionRepository submissionRepository;
    private final SubmissionHistoryRepository submissionHistoryRepository;
    private final AthleteRepository athleteRepository;
    private final ChallengeRepository challengeRepository;
    private final ChallengeGradeRepository challengeGradeRepository;
    private final DivisionMatcher divisionMatcher;
    private final GradeLadderResolver gradeLadderResolver;
    private final ProofValidator proofValidator;
    private final XpAwardCalculator xpAwardCalculator;
    private final ProgressionLedgerService progressionLedgerService;
    private final GradingNotificationPublisher gradingNotificationPublisher;
    private final GradingProperties gradingProperties;
    private final GradingResponseMapper gradingResponseMapper;

    @Transactional
    public SubmissionResponses.SubmissionDetail submit(SubmissionRequests.SubmitRequest request, EngineContext context) {
        Athlete athlete = findAthlete(request.athleteId());
        if (!context.actor().isPrivileged() && !context.actor().userId().equals(athlete.getUserId())) {
            throw GradingException.forbidden("Athletes can only submit for themselves");
        }
        Challenge challenge = findChallenge(request.challengeId());
        if (!challenge.isActive()) {
            throw GradingException.validation("challengeId", "Challenge " + challenge.getChallengeId() + " is not active");
        }
        proofValidator.validate(request, challenge);

        Optional<Submission> existing =
                submissionRepository.findByAthleteIdAndChallengeIdForUpdate(athlete.getAthleteId(), challenge.getChallengeId());

        Submission submission;
        if (existing.isPresent()) {
            submission = existing.get();
            if (submission.getStatus() == SubmissionStatus.APPROVED || submission.getStatus() == SubmissionStatus.REJECTED) {
                throw GradingException.conflict(
                        "submission_closed",
                        "Submission " + submission.getSubmissionId() + " is " + submission.getStatus()
                                + " and can only be reopened by an admin"
                );
            }
            archive(submission, context);
            applyProof(submission, request, context);
            submission = submissionRepository.save(submission);
            log.info("Athlete {} resubmitted challenge {} (submission {})",
                    athlete.getAthleteId(), challenge.getChallengeId(), submission.getSubmissionId());
        } else {
            submission = new Submission();
            submission.setSubmissionId(UUID.randomUUID());
            submission.setAthleteId(athlete.getAthleteId());
            submission.setChallengeId(challenge.getChallengeId());
            submission.setCreatedAt(context.now());
            applyProof(submission, request, context);
            try {
                submission = submissionRepository.saveAndFlush(submission);
            } catch (DataIntegrityViolationException ex) {
                throw GradingException.conflict(
                        "submission_already_exists",
                        "A submission for athlete " + athlete.getAthleteId() + " and challenge "
                                + challenge.getChallengeId() + " already exists"
                );
            }
            log.info("Athlete {} submitted challenge {} (submission {})",
                    athlete.getAthleteId(), challenge.getChallengeId(), submission.getSubmissionId());
        }

        if (context.actor().isPrivileged() && gradingProperties.isAutoApprovePrivileged()) {
            submission.setAutoApproved(true);
            approve(submission, athlete, challenge, submission.getAchievedValue(), null, context);
        }
        return gradingResponseMapper.toSubmissionDetail(submission, false);
    }

    @Transactional
    public SubmissionResponses.SubmissionDetail review(
            UUID submissionId,
            SubmissionRequests.ReviewRequest request,
            EngineContext context
    ) {
        if (!context.actor().isPrivileged()) {
            throw GradingException.forbidden("Only coaches and admins may review submissions");
        }
        Submission submission = lockSubmission(submissionId);

        switch (request.decision()) {
            case APPROVED -> {
                if (submission.getStatus() == SubmissionStatus.APPROVED) {
                    return reapprove(submission, request.achievedValue());
                }
                requirePending(submission);
                BigDecimal value = request.achievedValue() != null
                        ? request.achievedValue()
                        : submission.getAchievedValue();
                proofValidator.validateAchievedValue(value);
                approve(
                        submission,
                        findAthlete(submission.getAthleteId()),
                        findChallenge(submission.getChallengeId()),
                        value,
                        request.reviewNotes(),
                        context
                );
            }
            case REJECTED -> {
                requirePending(submission);
                close(submission, SubmissionStatus.REJECTED, request.reviewNotes(), context);
                gradingNotificationPublisher.submissionRejected(submission, context.now());
            }
            case NEEDS_REVISION -> {
                requirePending(submission);
                close(submission, SubmissionStatus.NEEDS_REVISION, request.reviewNotes(), context);
                gradingNotificationPublisher.submissionNeedsRevision(submission, context.now());
            }
        }
        return gradingResponseMapper.toSubmissionDetail(submission, false);
    }

    /**
     * Removes a submission. Admins may delete in any state; the owner only while it is not approved.
     * An approved submission has its XP and ranks reversed first; if that fails the row stays.
     */
    @Transactional
    public void delete(UUID submissionId, EngineContext context) {
        Submission submission = lockSubmission(submissionId);
        if (!context.actor().isAdmin()) {
            if (submission.getStatus() == SubmissionStatus.APPROVED) {
                throw GradingException.forbidden("Only gym or system admins may delete an approved submission");
            }
            if (!isOwner(submission, context.actor().userId())) {
                throw GradingException.forbidden("Only the owner or an admin may delete submission " + submissionId);
            }
        }
        if (submission.getStatus() == SubmissionStatus.APPROVED) {
            progressionLedgerService.reverseSubmission(submission, context);
        }
        submissionHistoryRepository.deleteBySubmissionId(submissionId);
        submissionRepository.delete(submission);
        log.info("Submission {} ({}) deleted by {}", submissionId, submission.getStatus(), context.actor().userId());
    }

    @Transactional
    public SubmissionResponses.SubmissionDetail reopen(UUID submissionId, EngineContext context) {
        if (!context.actor().isAdmin()) {
            throw GradingException.forbidden("Only gym or system admins may reopen submissions");
        }
        Submission submission = lockSubmission(submissionId);
        SubmissionStatus previous = submission.getStatus();
        switch (previous) {
            case APPROVED -> {
                progressionLedgerService.reverseSubmission(submission, context);
                submission.setAchievedTier(null);
                submission.setClaimedTiers(new ArrayList<>());
                submission.setXpAwarded(0);
                submission.setAutoApproved(false);
            }
            case REJECTED -> {
                // tier data is kept until the next approval overwrites it
            }
            case PENDING, NEEDS_REVISION -> throw GradingException.conflict(
                    "submission_not_closed",
                    "Submission " + submissionId + " is " + previous + "; only APPROVED or REJECTED submissions can be reopened"
            );
        }
        submission.setStatus(SubmissionStatus.PENDING);
        submission.setUpdatedAt(context.now());
        submission = submissionRepository.save(submission);
        log.info("Submission {} reopened from {} by {}", submissionId, previous, context.actor().userId());
        return gradingResponseMapper.toSubmissionDetail(submission, false);
    }

    @Transactional(readOnly = true)
    public SubmissionResponses.SubmissionDetail getSubmission(UUID submissionId, EngineContext context) {
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> GradingException.notFound("Submission", submissionId));
        return gradingResponseMapper.toSubmissionDetail(submission, shouldMaskValue(submission, context));
    }

    @Transactional(readOnly = true)
    public List<SubmissionResponses.SubmissionHistoryEntry> getHistory(UUID submissionId) {
        if (!submissionRepository.existsById(submissionId)) {
            throw GradingException.notFound("Submission", submissionId);
        }
        return gradingResponseMapper.toHistoryEntries(
                submissionHistoryRepository.findBySubmissionIdOrderByVersionDesc(submissionId));
    }

    private void approve(
            Submission submission,
            Athlete athlete,
            Challenge challenge,
            BigDecimal achievedValue,
            String reviewNotes,
            EngineContext context
    ) {
        Optional<Division> division = divisionMatcher.match(athlete.getDateOfBirth(), athlete.getGender(), context.today());
        LadderResolution resolution = LadderResolution.ungraded();
        if (division.isEmpty()) {
            log.warn("No division matches athlete {}; approving submission {} without a tier or XP",
                    athlete.getAthleteId(), submission.getSubmissionId());
        } else {
            UUID divisionId = division.get().getDivisionId();
            List<ChallengeGrade> grades =
                    challengeGradeRepository.findByChallengeIdAndDivisionId(challenge.getChallengeId(), divisionId);
            if (achievedValue == null
                    && !grades.isEmpty()
                    && challenge.getGradingType().direction() != GradingDirection.UNGRADED) {
                throw GradingException.validation(
                        "achievedValue",
                        "achievedValue is required to grade challenge " + challenge.getChallengeId()
                );
            }
            resolution = gradeLadderResolver.resolveForDivision(achievedValue, grades, divisionId, challenge.getGradingType());
        }

        submission.setAchievedValue(achievedValue);
        submission.setAchievedTier(resolution.highestTier());
        submission.setClaimedTiers(new ArrayList<>(resolution.claimedTiers()));
        submission.setDivisionId(division.map(Division::getDivisionId).orElse(null));
        submission.setStatus(SubmissionStatus.APPROVED);
        if (reviewNotes != null) {
            submission.setReviewNotes(reviewNotes);
        }
        submission.setReviewedByUserId(context.actor().userId());
        submission.setReviewedAt(context.now());
        submission.setUpdatedAt(context.now());
        submissionRepository.save(submission);

        int baseXp = division.isPresent() ? xpAwardCalculator.baseXp(resolution, challenge) : 0;
        Map<UUID, Integer> shares = xpAwardCalculator.distribute(baseXp, challenge);
        int awarded = 0;
        for (Map.Entry<UUID, Integer> share : shares.entrySet()) {
            progressionLedgerService.apply(new XpMovement(
                    submission.getAthleteId(),
                    share.getKey(),
                    share.getValue(),
                    XpSource.CHALLENGE,
                    submission.getSubmissionId(),
                    "Approved " + challenge.getName()
            ), context);
            awarded += share.getValue();
        }
        submission.setXpAwarded(awarded);
        submissionRepository.save(submission);

        log.info(
                "Submission {} approved by {}: tier={} claimed={} xp={}",
                submission.getSubmissionId(),
                context.actor().userId(),
                resolution.highestTier(),
                resolution.claimedTiers(),
                awarded
        );
        gradingNotificationPublisher.submissionApproved(submission, context.now());
    }

    private SubmissionResponses.SubmissionDetail reapprove(Submission submission, BigDecimal requestedValue) {
        if (requestedValue == null
                || (submission.getAchievedValue() != null && requestedValue.compareTo(submission.getAchievedValue()) == 0)) {
            log.info("Submission {} already approved; ignoring repeated approval", submission.getSubmissionId());
            return gradingResponseMapper.toSubmissionDetail(submission, false);
        }
        throw GradingException.conflict(
                "submission_already_reviewed",
                "Submission " + submission.getSubmissionId() + " is already approved with value "
                        + submission.getAchievedValue() + "; reopen it to change the value"
        );
    }

    private void close(Submission submission, SubmissionStatus status, String reviewNotes, EngineContext context) {
        submission.setStatus(status);
        submission.setReviewNotes(reviewNotes);
        submission.setReviewedByUserId(context.actor().userId());
        submission.setReviewedAt(context.now());
        submission.setUpdatedAt(context.now());
        submissionRepository.save(submission);
        log.info("Submission {} marked {} by {}", submission.getSubmissionId(), status, context.actor().userId());
    }

    private void applyProof(Submission submission, SubmissionRequests.SubmitRequest request, EngineContext context) {
        submission.setSubmittedByUserId(context.actor().userId());
        submission.setProofType(request.proofType());
        submission.setVideoUrl(request.videoUrl());
        submission.setImageUrl(request.imageUrl());
        submission.setStravaActivityId(request.stravaActivityId());
        submission.setGarminActivityId(request.garminActivityId());
        submission.setSupervisorId(request.supervisorId());
        submission.setSupervisorName(request.supervisorName());
        submission.setNotes(request.notes());
        submission.setAchievedValue(request.achievedValue());
        submission.setAchievedTier(null);
        submission.setClaimedTiers(new ArrayList<>());
        submission.setStatus(SubmissionStatus.PENDING);
        submission.setReviewNotes(null);
        submission.setReviewedByUserId(null);
        submission.setReviewedAt(null);
        submission.setXpAwarded(0);
        submission.setAutoApproved(false);
        if (request.isPublic() != null) {
            submission.setPublicVisible(request.isPublic());
        }
        if (request.hideExactValue() != null) {
            submission.setHideExactValue(request.hideExactValue());
        }
        submission.setSubmittedAt(context.now());
        submission.setUpdatedAt(context.now());
    }

    private void archive(Submission submission, EngineContext context) {
        SubmissionHistory history = new SubmissionHistory();
        history.setHistoryId(UUID.randomUUID());
        history.setSubmissionId(submission.getSubmissionId());
        history.setVersion((int) submissionHistoryRepository.countBySubmissionId(submission.getSubmissionId()) + 1);
        history.setProofType(submission.getProofType());
        history.setVideoUrl(submission.getVideoUrl());
        history.setImageUrl(submission.getImageUrl());
        history.setNotes(submission.getNotes());
        history.setAchievedValue(submission.getAchievedValue());
        history.setStatus(submission.getStatus());
        history.setReviewNotes(submission.getReviewNotes());
        history.setReviewedByUserId(submission.getReviewedByUserId());
        history.setSubmittedAt(submission.getSubmittedAt());
        history.setReviewedAt(submission.getReviewedAt());
        history.setArchivedAt(context.now());
        submissionHistoryRepository.save(history);
    }

    private boolean shouldMaskValue(Submission submission, EngineContext context) {
        if (!submission.isHideExactValue() || context.actor().isPrivileged()) {
            return false;
        }
        return !isOwner(submission, context.actor().userId());
    }

    private boolean isOwner(Submission submission, UUID userId) {
        if (userId.equals(submission.getSubmittedByUserId())) {
            return true;
        }
        return athleteRepository.findById(submission.getAthleteId())
                .map(athlete -> userId.equals(athlete.getUserId()))
                .orElse(false);
    }

    private static void requirePending(Submission submission) {
        if (submission.getStatus() != SubmissionStatus.PENDING) {
            throw GradingException.conflict(
                    "submission_not_pending",
                    "Submission " + submission.getSubmissionId() + " is " + submission.getStatus()
                            + "; only PENDING submissions can be reviewed"
            );
        }
    }

    private Submission lockSubmission(UUID submissionId) {
        return submissionRepository.findBySubmissionIdForUpdate(submissionId)
                .orElseThrow(() -> GradingException.notFound("Submission", submissionId));
    }

    private Athlete findAthlete(UUID athleteId) {
        return athleteRepository.findById(athleteId)
                .orElseThrow(() -> GradingException.notFound("Athlete", athleteId));
    }

    private Challenge findChallenge(UUID challengeId) {
        return challengeRepository.findById(challengeId)
                .orElseThrow(() -> GradingException.notFound("Challenge", challengeId));
    }
}

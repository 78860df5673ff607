package com.peakrank.service;

import com.peakrank.controller.dto.ProgressionResponses;
import com.peakrank.controller.dto.SubmissionRequests;
import com.peakrank.mapper.GradingResponseMapper;
import com.peakrank.model.Athlete;
import com.peakrank.model.Division;
import com.peakrank.model.DomainProgress;
import com.peakrank.model.Submission;
import com.peakrank.model.XpSource;
import com.peakrank.model.XpTransaction;
import com.peakrank.repository.AthleteRepository;
import com.peakrank.repository.ChallengeRepository;
import com.peakrank.repository.DomainProgressRepository;
import com.peakrank.repository.DomainXpTotal;
import com.peakrank.repository.RankUnlockRepository;
import com.peakrank.repository.XpTransactionRepository;
import com.peakrank.web.GradingException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-domain XP ledger. Every movement is recorded as an {@link XpTransaction}; the progress row holds
 * the running total and the level derived from it, and is locked for the read-modify-write.
 */
@Service
@RequiredArgsConstructor
public class ProgressionLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ProgressionLedgerService.class);

    private final DomainProgressRepository domainProgressRepository;
    private final XpTransactionRepository xpTransactionRepository;
    private final RankUnlockRepository rankUnlockRepository;
    private final AthleteRepository athleteRepository;
    private final ChallengeRepository challengeRepository;
    private final DivisionMatcher divisionMatcher;
    private final RankUnlockEvaluator rankUnlockEvaluator;
    private final LevelTable levelTable;
    private final GradingResponseMapper gradingResponseMapper;

    /**
     * Credits (or debits) {@code movement.amount} and re-evaluates the domain's ranks without revocation.
     */
    @Transactional
    public ProgressionChange apply(XpMovement movement, EngineContext context) {
        return applyDelta(movement, movement.amount(), false, null, context);
    }

    /**
     * Exact inverse of {@link #apply}: debits {@code movement.amount} as a reversal and lets ranks be revoked.
     */
    @Transactional
    public ProgressionChange reverse(XpMovement movement, EngineContext context) {
        XpMovement reversal = new XpMovement(
                movement.athleteId(),
                movement.domainId(),
                movement.amount(),
                XpSource.REVERSAL,
                movement.sourceSubmissionId(),
                movement.note()
        );
        return applyDelta(reversal, -movement.amount(), true, movement.sourceSubmissionId(), context);
    }

    /**
     * Undoes everything the ledger holds for a submission and re-evaluates the ranks of the challenge's
     * domains as if the submission no longer counted.
     */
    @Transactional
    public List<ProgressionChange> reverseSubmission(Submission submission, EngineContext context) {
        UUID submissionId = submission.getSubmissionId();
        List<ProgressionChange> changes = new ArrayList<>();
        Set<UUID> touchedDomains = new LinkedHashSet<>();

        for (DomainXpTotal total : xpTransactionRepository.sumBySubmissionGroupedByDomain(submissionId)) {
            long net = total.totalXp() == null ? 0L : total.totalXp();
            touchedDomains.add(total.domainId());
            if (net == 0L) {
                continue;
            }
            XpMovement movement = new XpMovement(
                    submission.getAthleteId(),
                    total.domainId(),
                    net,
                    XpSource.CHALLENGE,
                    submissionId,
                    "Reversal of submission " + submissionId
            );
            changes.add(reverse(movement, context));
        }

        UUID divisionId = resolveDivisionId(submission.getAthleteId(), context);
        for (UUID domainId : challengeDomains(submission.getChallengeId())) {
            if (touchedDomains.contains(domainId)) {
                continue;
            }
            List<RankChange> rankChanges = rankUnlockEvaluator.evaluate(
                    submission.getAthleteId(), domainId, divisionId, true, submissionId, context.now());
            if (!rankChanges.isEmpty()) {
                DomainProgress progress = domainProgressRepository
                        .findByAthleteIdAndDomainIdForUpdate(submission.getAthleteId(), domainId)
                        .orElse(null);
                long xp = progress == null ? 0L : progress.getCurrentXp();
                int level = progress == null ? 0 : progress.getLevel();
                changes.add(new ProgressionChange(
                        submission.getAthleteId(), domainId, xp, xp, level, level, rankChanges));
            }
        }
        return changes;
    }

    @Transactional
    public ProgressionChange adjust(UUID athleteId, SubmissionRequests.AdjustXpRequest request, EngineContext context) {
        requireAdmin(context, "adjust XP");
        findAthlete(athleteId);
        if (request.amount() == null || request.amount() == 0L) {
            throw GradingException.validation("amount", "amount must be non-zero");
        }
        XpMovement movement = new XpMovement(
                athleteId,
                request.domainId(),
                request.amount(),
                XpSource.ADMIN,
                null,
                request.note()
        );
        return applyDelta(movement, request.amount(), false, null, context);
    }

    /**
     * Recomputes every domain's XP and level from the ledger sums.
     */
    @Transactional
    public List<ProgressionChange> reconcile(UUID athleteId, EngineContext context) {
        requireAdmin(context, "reconcile XP");
        findAthlete(athleteId);

        Map<UUID, Long> ledgerTotals = new LinkedHashMap<>();
        for (DomainXpTotal total : xpTransactionRepository.sumByAthleteGroupedByDomain(athleteId)) {
            ledgerTotals.put(total.domainId(), total.totalXp() == null ? 0L : total.totalXp());
        }
        for (DomainProgress progress : domainProgressRepository.findByAthleteIdOrderByDomainIdAsc(athleteId)) {
            ledgerTotals.putIfAbsent(progress.getDomainId(), 0L);
        }

        List<ProgressionChange> changes = new ArrayList<>();
        for (Map.Entry<UUID, Long> entry : ledgerTotals.entrySet()) {
            long expectedXp = entry.getValue();
            if (expectedXp < 0) {
                throw GradingException.conflict(
                        "ledger_negative_total",
                        "Ledger total for domain " + entry.getKey() + " is negative: " + expectedXp
                );
            }
            DomainProgress progress = lockOrCreateProgress(athleteId, entry.getKey(), context);
            long previousXp = progress.getCurrentXp();
            int previousLevel = progress.getLevel();
            int expectedLevel = levelTable.levelFor(expectedXp);
            if (previousXp == expectedXp && previousLevel == expectedLevel) {
                continue;
            }
            progress.setCurrentXp(expectedXp);
            progress.setLevel(expectedLevel);
            progress.setUpdatedAt(context.now());
            domainProgressRepository.save(progress);
            log.warn(
                    "Reconciled athlete {} domain {}: xp {} -> {}, level {} -> {}",
                    athleteId, entry.getKey(), previousXp, expectedXp, previousLevel, expectedLevel
            );
            changes.add(new ProgressionChange(
                    athleteId, entry.getKey(), previousXp, expectedXp, previousLevel, expectedLevel, List.of()));
        }
        return changes;
    }

    @Transactional(readOnly = true)
    public ProgressionResponses.AthleteProgression getProgression(UUID athleteId) {
        findAthlete(athleteId);
        List<ProgressionResponses.DomainProgressView> domains = domainProgressRepository
                .findByAthleteIdOrderByDomainIdAsc(athleteId)
                .stream()
                .map(progress -> gradingResponseMapper.toDomainProgressView(progress, levelTable))
                .toList();
        return gradingResponseMapper.toAthleteProgression(
                athleteId,
                domains,
                rankUnlockRepository.findByAthleteIdOrderByUnlockedAtAsc(athleteId)
        );
    }

    private ProgressionChange applyDelta(
            XpMovement movement,
            long delta,
            boolean allowRevocation,
            UUID excludedSubmissionId,
            EngineContext context
    ) {
        UUID athleteId = movement.athleteId();
        UUID domainId = movement.domainId();
        DomainProgress progress = lockOrCreateProgress(athleteId, domainId, context);

        long previousXp = progress.getCurrentXp();
        int previousLevel = progress.getLevel();
        long newXp = previousXp + delta;
        if (newXp < 0) {
            if (movement.source() == XpSource.REVERSAL) {
                throw GradingException.reversalFailed(
                        "Reversing " + movement.amount() + " XP would leave athlete " + athleteId
                                + " with negative XP in domain " + domainId + " (current " + previousXp + ")"
                );
            }
            throw GradingException.validation(
                    "amount",
                    "XP for domain " + domainId + " cannot go below zero (current " + previousXp + ")"
            );
        }
        int newLevel = levelTable.levelFor(newXp);

        progress.setCurrentXp(newXp);
        progress.setLevel(newLevel);
        progress.setUpdatedAt(context.now());
        domainProgressRepository.save(progress);

        XpTransaction transaction = new XpTransaction();
        transaction.setTransactionId(UUID.randomUUID());
        transaction.setAthleteId(athleteId);
        transaction.setDomainId(domainId);
        transaction.setAmount(delta);
        transaction.setSource(movement.source());
        transaction.setSourceSubmissionId(movement.sourceSubmissionId());
        transaction.setNote(movement.note());
        transaction.setCreatedByUserId(context.actor().userId());
        transaction.setCreatedAt(context.now());
        xpTransactionRepository.save(transaction);

        if (newLevel != previousLevel) {
            log.info(
                    "Athlete {} domain {} level {} -> {} ({} XP)",
                    athleteId, domainId, LevelTable.displayOf(previousLevel), LevelTable.displayOf(newLevel), newXp
            );
        }
        log.info("Applied {} XP ({}) to athlete {} domain {}: {} -> {}",
                delta, movement.source(), athleteId, domainId, previousXp, newXp);

        List<RankChange> rankChanges = rankUnlockEvaluator.evaluate(
                athleteId,
                domainId,
                resolveDivisionId(athleteId, context),
                allowRevocation,
                excludedSubmissionId,
                context.now()
        );
        return new ProgressionChange(athleteId, domainId, previousXp, newXp, previousLevel, newLevel, rankChanges);
    }

    private DomainProgress lockOrCreateProgress(UUID athleteId, UUID domainId, EngineContext context) {
        Optional<DomainProgress> existing = domainProgressRepository.findByAthleteIdAndDomainIdForUpdate(athleteId, domainId);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (domainProgressRepository.insertIfAbsent(UUID.randomUUID(), athleteId, domainId, context.now()) > 0) {
            log.info("Started progress for athlete {} in domain {}", athleteId, domainId);
        }
        return domainProgressRepository.findByAthleteIdAndDomainIdForUpdate(athleteId, domainId)
                .orElseThrow(() -> new IllegalStateException(
                        "Progress row for athlete " + athleteId + " domain " + domainId + " missing after insert"));
    }

    private UUID resolveDivisionId(UUID athleteId, EngineContext context) {
        return athleteRepository.findById(athleteId)
                .flatMap(athlete -> divisionMatcher.match(athlete.getDateOfBirth(), athlete.getGender(), context.today()))
                .map(Division::getDivisionId)
                .orElse(null);
    }

    private Set<UUID> challengeDomains(UUID challengeId) {
        Set<UUID> domains = new LinkedHashSet<>();
        challengeRepository.findById(challengeId).ifPresent(challenge -> {
            addIfPresent(domains, challenge.getPrimaryDomainId());
            addIfPresent(domains, challenge.getSecondaryDomainId());
            addIfPresent(domains, challenge.getTertiaryDomainId());
        });
        return domains;
    }

    private static void addIfPresent(Set<UUID> domains, UUID domainId) {
        if (domainId != null) {
            domains.add(domainId);
        }
    }

    private Athlete findAthlete(UUID athleteId) {
        return athleteRepository.findById(athleteId)
                .orElseThrow(() -> GradingException.notFound("Athlete", athleteId));
    }

    private static void requireAdmin(EngineContext context, String action) {
        if (!context.actor().isAdmin()) {
            throw GradingException.forbidden("Only gym or system admins may " + action);
        }
    }
}

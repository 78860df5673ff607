package com.peakrank.service;

import com.peakrank.model.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Fire-and-forget notifications. Events raised inside a transaction are only delivered once it commits,
 * and a failing sink never affects the transition that raised the event.
 */
@Service
public class GradingNotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(GradingNotificationPublisher.class);

    private final List<GradingNotificationSink> sinks;

    public GradingNotificationPublisher(List<GradingNotificationSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public void submissionApproved(Submission submission, OffsetDateTime now) {
        publish(submissionEvent(GradingEvent.Type.SUBMISSION_APPROVED, submission, now));
    }

    public void submissionRejected(Submission submission, OffsetDateTime now) {
        publish(submissionEvent(GradingEvent.Type.SUBMISSION_REJECTED, submission, now));
    }

    public void submissionNeedsRevision(Submission submission, OffsetDateTime now) {
        publish(submissionEvent(GradingEvent.Type.SUBMISSION_NEEDS_REVISION, submission, now));
    }

    public void rankUnlocked(UUID athleteId, UUID domainId, String rankName, OffsetDateTime now) {
        publish(new GradingEvent(
                GradingEvent.Type.RANK_UNLOCKED,
                athleteId,
                null,
                null,
                null,
                null,
                domainId,
                rankName,
                null,
                now
        ));
    }

    private void publish(GradingEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    deliver(event);
                }
            });
            return;
        }
        deliver(event);
    }

    private void deliver(GradingEvent event) {
        for (GradingNotificationSink sink : sinks) {
            try {
                sink.deliver(event);
            } catch (RuntimeException ex) {
                log.warn(
                        "Notification sink {} failed for {} (athlete {}): {}",
                        sink.getClass().getSimpleName(),
                        event.type(),
                        event.athleteId(),
                        ex.getMessage(),
                        ex
                );
            }
        }
    }

    private static GradingEvent submissionEvent(GradingEvent.Type type, Submission submission, OffsetDateTime now) {
        return new GradingEvent(
                type,
                submission.getAthleteId(),
                submission.getSubmissionId(),
                submission.getChallengeId(),
                submission.getAchievedTier(),
                submission.getXpAwarded(),
                null,
                null,
                submission.getReviewNotes(),
                now
        );
    }
}

package com.peakrank.repository;

import com.peakrank.model.Submission;
import com.peakrank.model.SubmissionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Submission s where s.submissionId = :submissionId")
    Optional<Submission> findBySubmissionIdForUpdate(@Param("submissionId") UUID submissionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Submission s where s.athleteId = :athleteId and s.challengeId = :challengeId")
    Optional<Submission> findByAthleteIdAndChallengeIdForUpdate(
            @Param("athleteId") UUID athleteId,
            @Param("challengeId") UUID challengeId
    );

    @Query("""
            select new com.peakrank.repository.ApprovedTierRow(s.submissionId, s.challengeId, s.achievedTier)
            from Submission s
            where s.athleteId = :athleteId
              and s.status = :status
              and s.challengeId in :challengeIds
              and s.achievedTier is not null
            """)
    List<ApprovedTierRow> findTierRows(
            @Param("athleteId") UUID athleteId,
            @Param("status") SubmissionStatus status,
            @Param("challengeIds") List<UUID> challengeIds
    );
}

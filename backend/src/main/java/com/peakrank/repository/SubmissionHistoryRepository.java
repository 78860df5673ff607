package com.peakrank.repository;

import com.peakrank.model.SubmissionHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SubmissionHistoryRepository extends JpaRepository<SubmissionHistory, UUID> {
    long countBySubmissionId(UUID submissionId);

    List<SubmissionHistory> findBySubmissionIdOrderByVersionDesc(UUID submissionId);

    @Modifying
    @Query("delete from SubmissionHistory h where h.submissionId = :submissionId")
    int deleteBySubmissionId(@Param("submissionId") UUID submissionId);
}

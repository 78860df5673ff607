package com.peakrank.repository;

import com.peakrank.model.ChallengeGrade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ChallengeGradeRepository extends JpaRepository<ChallengeGrade, UUID> {
    List<ChallengeGrade> findByChallengeIdAndDivisionId(UUID challengeId, UUID divisionId);
}

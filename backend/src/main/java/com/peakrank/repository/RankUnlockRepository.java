package com.peakrank.repository;

import com.peakrank.model.RankUnlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RankUnlockRepository extends JpaRepository<RankUnlock, UUID> {
    List<RankUnlock> findByAthleteIdAndDomainId(UUID athleteId, UUID domainId);

    List<RankUnlock> findByAthleteIdOrderByUnlockedAtAsc(UUID athleteId);
}

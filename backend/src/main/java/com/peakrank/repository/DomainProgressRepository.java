package com.peakrank.repository;

import com.peakrank.model.DomainProgress;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DomainProgressRepository extends JpaRepository<DomainProgress, UUID> {

    List<DomainProgress> findByAthleteIdOrderByDomainIdAsc(UUID athleteId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from DomainProgress p where p.athleteId = :athleteId and p.domainId = :domainId")
    Optional<DomainProgress> findByAthleteIdAndDomainIdForUpdate(
            @Param("athleteId") UUID athleteId,
            @Param("domainId") UUID domainId
    );

    /**
     * Creates an empty progress row unless one exists. A concurrent insert of the same pair waits on the
     * unique key and then does nothing, so the following locked read always finds exactly one row.
     */
    @Modifying
    @Query(value = """
            insert into domain_progress (progress_id, athlete_id, domain_id, current_xp, level, created_at, updated_at)
            values (:progressId, :athleteId, :domainId, 0, 0, :createdAt, :createdAt)
            on conflict (athlete_id, domain_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("progressId") UUID progressId,
            @Param("athleteId") UUID athleteId,
            @Param("domainId") UUID domainId,
            @Param("createdAt") OffsetDateTime createdAt
    );
}

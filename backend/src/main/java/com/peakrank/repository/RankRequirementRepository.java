package com.peakrank.repository;

import com.peakrank.model.RankRequirement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RankRequirementRepository extends JpaRepository<RankRequirement, UUID> {

    @Query("""
            select r from RankRequirement r
            where r.domainId = :domainId
              and r.active = true
              and (r.divisionId is null or r.divisionId = :divisionId)
            order by r.createdAt asc
            """)
    List<RankRequirement> findApplicable(
            @Param("domainId") UUID domainId,
            @Param("divisionId") UUID divisionId
    );
}

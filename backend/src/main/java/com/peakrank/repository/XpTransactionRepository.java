package com.peakrank.repository;

import com.peakrank.model.XpTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface XpTransactionRepository extends JpaRepository<XpTransaction, UUID> {

    @Query("""
            select new com.peakrank.repository.DomainXpTotal(t.domainId, sum(t.amount))
            from XpTransaction t
            where t.sourceSubmissionId = :submissionId
            group by t.domainId
            order by t.domainId
            """)
    List<DomainXpTotal> sumBySubmissionGroupedByDomain(@Param("submissionId") UUID submissionId);

    @Query("""
            select new com.peakrank.repository.DomainXpTotal(t.domainId, sum(t.amount))
            from XpTransaction t
            where t.athleteId = :athleteId
            group by t.domainId
            order by t.domainId
            """)
    List<DomainXpTotal> sumByAthleteGroupedByDomain(@Param("athleteId") UUID athleteId);
}

package com.peakrank.repository;

import com.peakrank.model.RankRequirementItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RankRequirementItemRepository extends JpaRepository<RankRequirementItem, UUID> {
    List<RankRequirementItem> findByRequirementIdIn(Collection<UUID> requirementIds);
}

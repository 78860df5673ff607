package com.peakrank.repository;

import java.util.UUID;

public record DomainXpTotal(
        UUID domainId,
        Long totalXp
) {
}

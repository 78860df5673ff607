package com.peakrank.service;

import com.peakrank.model.XpSource;

import java.util.Objects;
import java.util.UUID;

public record XpMovement(
        UUID athleteId,
        UUID domainId,
        long amount,
        XpSource source,
        UUID sourceSubmissionId,
        String note
) {

    public XpMovement {
        Objects.requireNonNull(athleteId, "athleteId is required");
        Objects.requireNonNull(domainId, "domainId is required");
        Objects.requireNonNull(source, "source is required");
    }
}

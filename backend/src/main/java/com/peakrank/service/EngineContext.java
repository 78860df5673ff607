package com.peakrank.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Per-call context handed to every engine operation: who is acting and the instant the call is evaluated at.
 */
public record EngineContext(Actor actor, OffsetDateTime now) {

    public EngineContext {
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(now, "now is required");
    }

    public static EngineContext of(Actor actor, Clock clock) {
        return new EngineContext(actor, OffsetDateTime.now(clock));
    }

    public LocalDate today() {
        return now.toLocalDate();
    }
}

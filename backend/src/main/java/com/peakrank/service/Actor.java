package com.peakrank.service;

import com.peakrank.model.ActorRole;

import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated caller as resolved by the identity provider in front of the engine.
 */
public record Actor(UUID userId, ActorRole role) {

    public Actor {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(role, "role is required");
    }

    public boolean isPrivileged() {
        return role.isPrivileged();
    }

    public boolean isAdmin() {
        return role.isAdmin();
    }
}

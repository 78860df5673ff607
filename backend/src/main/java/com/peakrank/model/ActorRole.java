package com.peakrank.model;

public enum ActorRole {
    ATHLETE,
    COACH,
    GYM_ADMIN,
    SYSTEM_ADMIN;

    /**
     * Roles that may review submissions and have their own submissions auto-approved.
     */
    public boolean isPrivileged() {
        return this != ATHLETE;
    }

    public boolean isAdmin() {
        return this == GYM_ADMIN || this == SYSTEM_ADMIN;
    }
}

package com.peakrank.controller;

/**
 * Headers set by the identity provider in front of this service.
 */
final class ActorHeaders {

    static final String ACTOR_ID = "X-Actor-Id";
    static final String ACTOR_ROLE = "X-Actor-Role";

    private ActorHeaders() {
    }
}

package com.peakrank.service;

import java.util.UUID;

/**
 * A rank gained ({@code unlocked}) or revoked during one evaluation.
 */
public record RankChange(UUID requirementId, UUID domainId, String rankName, boolean unlocked) {
}

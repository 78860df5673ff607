package com.peakrank.model;

public enum ReviewDecision {
    APPROVED,
    REJECTED,
    NEEDS_REVISION
}

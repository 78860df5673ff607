package com.peakrank.model;

public enum XpSource {
    CHALLENGE,
    REVERSAL,
    ADMIN
}

package com.peakrank.model;

public enum ProofType {
    VIDEO,
    IMAGE,
    STRAVA,
    GARMIN,
    RACE_RESULT,
    MANUAL
}

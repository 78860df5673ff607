package com.peakrank.model;

public enum GradingDirection {
    LOWER_IS_BETTER,
    HIGHER_IS_BETTER,
    UNGRADED
}

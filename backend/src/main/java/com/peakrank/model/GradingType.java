package com.peakrank.model;

public enum GradingType {
    TIME,
    REPS,
    DISTANCE,
    WEIGHTED_REPS,
    TIMED_REPS,
    PASS_FAIL;

    public GradingDirection direction() {
        return switch (this) {
            case TIME -> GradingDirection.LOWER_IS_BETTER;
            case REPS, DISTANCE, WEIGHTED_REPS, TIMED_REPS -> GradingDirection.HIGHER_IS_BETTER;
            case PASS_FAIL -> GradingDirection.UNGRADED;
        };
    }
}

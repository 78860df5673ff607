package com.peakrank.model;

public enum SubmissionStatus {
    PENDING,
    APPROVED,
    REJECTED,
    NEEDS_REVISION
}

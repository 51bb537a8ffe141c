package com.submissionhub.core.model;

public enum SyncStatus {
    COMPLETED,
    PARTIAL_FAILURE,
    FAILED,
    IN_PROGRESS
}

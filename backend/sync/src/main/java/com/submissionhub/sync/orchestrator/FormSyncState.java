package com.submissionhub.sync.orchestrator;

public enum FormSyncState {
    PENDING,
    FETCHING,
    PARSING,
    UPSERTED,
    SKIPPED
}

package com.submissionhub.sync.orchestrator;

// IDLE -> LOCKED -> VERIFYING -> SYNCING -> terminal -> IDLE
public enum SyncPhase {
    IDLE,
    LOCKED,
    VERIFYING,
    SYNCING,
    COMPLETED,
    PARTIAL_FAILURE,
    FAILED
}

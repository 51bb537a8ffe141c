package com.submissionhub.core.model;

import java.time.Instant;

public record SyncResult(
        long siteId,
        int formsFound,
        int submissionsSynced,
        int formsSkipped,
        int entriesSkipped,
        SyncStatus status,
        String message,
        ErrorKind errorKind,
        Instant startedAt,
        Instant finishedAt
) {
    public static SyncResult inProgress(long siteId, Instant now) {
        return new SyncResult(
                siteId, 0, 0, 0, 0,
                SyncStatus.IN_PROGRESS,
                "Sync already in progress for site " + siteId,
                ErrorKind.RESOURCE_LOCK,
                now,
                now
        );
    }

    public static SyncResult failed(long siteId, ErrorKind kind, String message, Instant startedAt, Instant finishedAt) {
        return new SyncResult(siteId, 0, 0, 0, 0, SyncStatus.FAILED, message, kind, startedAt, finishedAt);
    }

    public boolean success() {
        return status == SyncStatus.COMPLETED;
    }
}

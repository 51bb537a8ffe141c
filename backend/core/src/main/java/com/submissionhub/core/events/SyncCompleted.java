package com.submissionhub.core.events;

import com.submissionhub.core.model.SyncStatus;

import java.time.Instant;

public record SyncCompleted(
        Instant timestamp,
        long siteId,
        SyncStatus status,
        int formsFound,
        int submissionsSynced,
        String message,
        long durationMillis
) implements SiteEvent {
    @Override
    public String type() {
        return "SyncCompleted";
    }
}

package com.submissionhub.core.events;

import java.time.Instant;

public record SyncStarted(
        Instant timestamp,
        long siteId,
        String trigger
) implements SiteEvent {
    @Override
    public String type() {
        return "SyncStarted";
    }
}

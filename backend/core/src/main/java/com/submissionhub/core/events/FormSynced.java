package com.submissionhub.core.events;

import java.time.Instant;

public record FormSynced(
        Instant timestamp,
        long siteId,
        long formId,
        int pagesFetched,
        int submissionsSynced,
        int entriesSkipped
) implements SiteEvent {
    @Override
    public String type() {
        return "FormSynced";
    }
}

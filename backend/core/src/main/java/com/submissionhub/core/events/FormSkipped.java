package com.submissionhub.core.events;

import com.submissionhub.core.model.ErrorKind;

import java.time.Instant;

public record FormSkipped(
        Instant timestamp,
        long siteId,
        long formId,
        ErrorKind errorKind,
        String reason
) implements SiteEvent {
    @Override
    public String type() {
        return "FormSkipped";
    }
}

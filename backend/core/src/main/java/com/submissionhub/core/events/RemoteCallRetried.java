package com.submissionhub.core.events;

import java.time.Instant;

public record RemoteCallRetried(
        Instant timestamp,
        String operation,
        int attempt,
        long delayMillis,
        String reason
) implements Event {
    @Override
    public String type() {
        return "RemoteCallRetried";
    }
}

package com.submissionhub.service.store;

import com.submissionhub.core.events.Event;
import com.submissionhub.core.events.SiteEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record EventQuery(Instant since, Optional<String> type, Optional<Long> siteId, int limit) {
    public static final int MAX_LIMIT = 1000;

    public EventQuery {
        since = Objects.requireNonNullElse(since, Instant.EPOCH);
        type = Objects.requireNonNullElse(type, Optional.empty());
        siteId = Objects.requireNonNullElse(siteId, Optional.empty());
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static EventQuery recent(int limit) {
        return new EventQuery(Instant.EPOCH, Optional.empty(), Optional.empty(), limit);
    }

    public boolean matches(Event event) {
        if (event.timestamp().isBefore(since)) {
            return false;
        }
        if (type.isPresent() && !type.get().equals(event.type())) {
            return false;
        }
        // alerts and retries carry no site and drop out of a site-filtered query
        return siteId.isEmpty() || event instanceof SiteEvent siteEvent && siteEvent.siteId() == siteId.get();
    }
}

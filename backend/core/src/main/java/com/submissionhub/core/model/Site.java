package com.submissionhub.core.model;

import java.time.Instant;
import java.util.Locale;

public record Site(
        long id,
        String name,
        String baseUrl,
        String credentialRef,
        Long contactFormId,
        Instant lastSyncedAt,
        boolean active
) {
    public Site {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Site " + id + " has no baseUrl");
        }
        baseUrl = baseUrl.strip();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        String lower = baseUrl.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new IllegalArgumentException("Site " + id + " baseUrl must use http or https: " + baseUrl);
        }
    }

    public Site withLastSyncedAt(Instant syncedAt) {
        return new Site(id, name, baseUrl, credentialRef, contactFormId, syncedAt, active);
    }
}

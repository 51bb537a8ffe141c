package com.submissionhub.sync.config;

import java.time.Duration;
import java.util.List;

// Missing or non-positive values fall back to the defaults.
public record SyncSettings(
        Duration requestTimeout,
        int maxAttempts,
        Duration retryBaseDelay,
        Duration retryMaxDelay,
        Double retryJitter,
        int pageSize,
        int batchSize,
        int maxPages,
        Duration formCacheTtl,
        int workerThreads,
        List<String> contactFormTitles,
        Duration syncInterval
) {
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_PAGE_SIZE = 500;
    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final int DEFAULT_MAX_PAGES = 1000;
    public static final Duration DEFAULT_FORM_CACHE_TTL = Duration.ofHours(1);
    public static final List<String> DEFAULT_CONTACT_FORM_TITLES = List.of("contact", "contact us", "contact form");

    public SyncSettings {
        requestTimeout = positiveOr(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        maxAttempts = maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        retryBaseDelay = positiveOr(retryBaseDelay, Duration.ofSeconds(1));
        retryMaxDelay = positiveOr(retryMaxDelay, Duration.ofSeconds(10));
        retryJitter = retryJitter == null || retryJitter < 0 ? 0.2 : Math.min(retryJitter, 1.0);
        pageSize = pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;
        batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
        maxPages = maxPages > 0 ? maxPages : DEFAULT_MAX_PAGES;
        formCacheTtl = positiveOr(formCacheTtl, DEFAULT_FORM_CACHE_TTL);
        workerThreads = workerThreads > 0 ? workerThreads : 4;
        contactFormTitles = contactFormTitles == null || contactFormTitles.isEmpty()
                ? DEFAULT_CONTACT_FORM_TITLES
                : List.copyOf(contactFormTitles);
        syncInterval = positiveOr(syncInterval, Duration.ofHours(3));
    }

    public static SyncSettings defaults() {
        return new SyncSettings(null, 0, null, null, null, 0, 0, 0, null, 0, null, null);
    }

    public SyncSettings withPaging(int nextPageSize, int nextBatchSize, int nextMaxPages) {
        return new SyncSettings(
                requestTimeout, maxAttempts, retryBaseDelay, retryMaxDelay, retryJitter,
                nextPageSize, nextBatchSize, nextMaxPages,
                formCacheTtl, workerThreads, contactFormTitles, syncInterval
        );
    }

    public SyncSettings withRequestTimeout(Duration timeout) {
        return new SyncSettings(
                timeout, maxAttempts, retryBaseDelay, retryMaxDelay, retryJitter,
                pageSize, batchSize, maxPages,
                formCacheTtl, workerThreads, contactFormTitles, syncInterval
        );
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}

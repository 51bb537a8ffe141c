package com.submissionhub.sync.api;

import com.submissionhub.core.model.Site;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SiteRepository {
    List<Site> activeSites();

    Optional<Site> find(long siteId);

    void markSynced(long siteId, Instant syncedAt);
}

package com.submissionhub.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.submissionhub.core.model.Site;
import com.submissionhub.core.util.JsonUtils;
import com.submissionhub.sync.api.SiteRepository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileSiteRepository implements SiteRepository {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Site> sites = new LinkedHashMap<>();

    public JsonFileSiteRepository(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public List<Site> activeSites() {
        lock.lock();
        try {
            List<Site> active = new ArrayList<>();
            for (Site site : sites.values()) {
                if (site.active()) {
                    active.add(site);
                }
            }
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Site> find(long siteId) {
        lock.lock();
        try {
            return Optional.ofNullable(sites.get(siteId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markSynced(long siteId, Instant syncedAt) {
        lock.lock();
        try {
            Site site = sites.get(siteId);
            if (site == null) {
                throw new IllegalStateException("Unknown site " + siteId + " in " + file);
            }
            sites.put(siteId, site.withLastSyncedAt(syncedAt));
            persist();
        } finally {
            lock.unlock();
        }
    }

    public List<Site> all() {
        lock.lock();
        try {
            return List.copyOf(sites.values());
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                SitesFile loaded = MAPPER.readValue(in, SitesFile.class);
                if (loaded.sites() == null) {
                    return;
                }
                for (Site site : loaded.sites()) {
                    if (sites.putIfAbsent(site.id(), site) != null) {
                        throw new IllegalStateException("Duplicate site id " + site.id() + " in " + file);
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading sites from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            JsonFiles.writeAtomically(file, new SitesFile(new ArrayList<>(sites.values())));
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing sites to " + file, e);
        }
    }

    private record SitesFile(List<Site> sites) {
    }
}

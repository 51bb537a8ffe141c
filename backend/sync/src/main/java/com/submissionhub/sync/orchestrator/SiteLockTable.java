package com.submissionhub.sync.orchestrator;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class SiteLockTable {
    private final ConcurrentMap<Long, SiteLease> held = new ConcurrentHashMap<>();

    public Optional<SiteLease> tryAcquire(long siteId) {
        SiteLease lease = new SiteLease(siteId);
        SiteLease existing = held.putIfAbsent(siteId, lease);
        return existing == null ? Optional.of(lease) : Optional.empty();
    }

    public boolean isLocked(long siteId) {
        return held.containsKey(siteId);
    }

    public final class SiteLease implements AutoCloseable {
        private final long siteId;

        private SiteLease(long siteId) {
            this.siteId = siteId;
        }

        public long siteId() {
            return siteId;
        }

        @Override
        public void close() {
            held.remove(siteId, this);
        }
    }
}

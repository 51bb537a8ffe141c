package com.submissionhub.sync.resolve;

import com.submissionhub.core.model.ResolvedForm;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

// One lock per site, so concurrent resolutions of a site trigger a single load.
public final class ResolvedFormCache {
    private final Clock clock;
    private final Duration ttl;
    private final Map<Long, CachedForm> entries = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ResolvedFormCache(Clock clock, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<ResolvedForm> get(long siteId) {
        ReentrantLock lock = lockFor(siteId);
        lock.lock();
        try {
            return fresh(siteId);
        } finally {
            lock.unlock();
        }
    }

    public void put(long siteId, ResolvedForm form) {
        ReentrantLock lock = lockFor(siteId);
        lock.lock();
        try {
            entries.put(siteId, new CachedForm(form, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    public Optional<ResolvedForm> getOrLoad(long siteId, Supplier<Optional<ResolvedForm>> loader) {
        ReentrantLock lock = lockFor(siteId);
        lock.lock();
        try {
            Optional<ResolvedForm> cached = fresh(siteId);
            if (cached.isPresent()) {
                return cached;
            }
            Optional<ResolvedForm> loaded = loader.get();
            loaded.ifPresent(form -> entries.put(siteId, new CachedForm(form, clock.instant())));
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(long siteId) {
        ReentrantLock lock = lockFor(siteId);
        lock.lock();
        try {
            entries.remove(siteId);
        } finally {
            lock.unlock();
        }
    }

    private Optional<ResolvedForm> fresh(long siteId) {
        CachedForm cached = entries.get(siteId);
        if (cached == null) {
            return Optional.empty();
        }
        Instant expiresAt = cached.resolvedAt().plus(ttl);
        if (!clock.instant().isBefore(expiresAt)) {
            entries.remove(siteId, cached);
            return Optional.empty();
        }
        return Optional.of(cached.form());
    }

    private ReentrantLock lockFor(long siteId) {
        return locks.computeIfAbsent(siteId, ignored -> new ReentrantLock());
    }

    private record CachedForm(ResolvedForm form, Instant resolvedAt) {
    }
}

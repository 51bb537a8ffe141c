package com.submissionhub.service.api;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.core.events.AlertRaised;
import com.submissionhub.core.events.Event;
import com.submissionhub.core.events.FormSkipped;
import com.submissionhub.core.events.RemoteCallRetried;
import com.submissionhub.core.events.SyncCompleted;
import com.submissionhub.core.events.SyncStarted;
import com.submissionhub.core.model.SyncStatus;
import com.submissionhub.service.store.EventCodec;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class SyncStatusTracker {
    private final LongAdder eventsTotal = new LongAdder();
    private final LongAdder retriesTotal = new LongAdder();
    private final LongAdder alertsTotal = new LongAdder();
    private final ConcurrentHashMap<Long, SiteStatus> siteStatuses = new ConcurrentHashMap<>();

    public SyncStatusTracker(EventBus eventBus) {
        EventCodec.subscribeAll(eventBus, this::onAnyEvent);
        eventBus.subscribe(SyncStarted.class, this::onSyncStarted);
        eventBus.subscribe(SyncCompleted.class, this::onSyncCompleted);
        eventBus.subscribe(FormSkipped.class, this::onFormSkipped);
        eventBus.subscribe(RemoteCallRetried.class, event -> retriesTotal.increment());
        eventBus.subscribe(AlertRaised.class, event -> alertsTotal.increment());
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> sites = new TreeMap<>();
        for (Map.Entry<Long, SiteStatus> entry : siteStatuses.entrySet()) {
            sites.put(String.valueOf(entry.getKey()), entry.getValue().toMap());
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("eventsTotal", eventsTotal.longValue());
        snapshot.put("retriesTotal", retriesTotal.longValue());
        snapshot.put("alertsTotal", alertsTotal.longValue());
        snapshot.put("sites", sites);
        return snapshot;
    }

    private void onAnyEvent(Event event) {
        eventsTotal.increment();
    }

    private void onSyncStarted(SyncStarted event) {
        siteStatuses.compute(event.siteId(), (id, current) -> orEmpty(current).started(event.timestamp()));
    }

    private void onSyncCompleted(SyncCompleted event) {
        siteStatuses.compute(event.siteId(), (id, current) -> orEmpty(current).completed(event));
    }

    private void onFormSkipped(FormSkipped event) {
        siteStatuses.compute(event.siteId(), (id, current) -> orEmpty(current).withFormSkipped());
    }

    private static SiteStatus orEmpty(SiteStatus status) {
        return status == null ? new SiteStatus(null, null, null, null, null, null, 0, 0) : status;
    }

    private record SiteStatus(
            Instant lastStartedAt,
            Instant lastFinishedAt,
            SyncStatus lastStatus,
            String lastMessage,
            Long lastDurationMillis,
            Integer lastSubmissionsSynced,
            int formsSkippedThisRun,
            int runs
    ) {
        private SiteStatus started(Instant at) {
            return new SiteStatus(at, lastFinishedAt, lastStatus, lastMessage, lastDurationMillis, lastSubmissionsSynced, 0, runs);
        }

        private SiteStatus completed(SyncCompleted event) {
            return new SiteStatus(
                    lastStartedAt,
                    event.timestamp(),
                    event.status(),
                    event.message(),
                    event.durationMillis(),
                    event.submissionsSynced(),
                    formsSkippedThisRun,
                    runs + 1
            );
        }

        private SiteStatus withFormSkipped() {
            return new SiteStatus(lastStartedAt, lastFinishedAt, lastStatus, lastMessage, lastDurationMillis,
                    lastSubmissionsSynced, formsSkippedThisRun + 1, runs);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("lastStartedAt", lastStartedAt == null ? null : lastStartedAt.toString());
            map.put("lastFinishedAt", lastFinishedAt == null ? null : lastFinishedAt.toString());
            map.put("lastStatus", lastStatus == null ? null : lastStatus.name());
            map.put("lastMessage", lastMessage);
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSubmissionsSynced", lastSubmissionsSynced);
            map.put("formsSkipped", formsSkippedThisRun);
            map.put("runs", runs);
            return map;
        }
    }
}

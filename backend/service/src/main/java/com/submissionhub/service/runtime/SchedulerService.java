package com.submissionhub.service.runtime;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.core.events.AlertRaised;
import com.submissionhub.core.model.SyncResult;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final Supplier<List<SyncResult>> syncAll;
    private final Duration interval;
    private final Duration initialDelay;
    private final EventBus eventBus;
    private final Clock clock;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "sync-scheduler");
        thread.setDaemon(true);
        return thread;
    });

    public SchedulerService(Supplier<List<SyncResult>> syncAll, Duration interval, EventBus eventBus, Clock clock) {
        this(syncAll, interval, Duration.ZERO, eventBus, clock);
    }

    SchedulerService(Supplier<List<SyncResult>> syncAll, Duration interval, Duration initialDelay, EventBus eventBus, Clock clock) {
        this.syncAll = syncAll;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void start() {
        timerExecutor.scheduleWithFixedDelay(
                this::runOnce,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        LOGGER.info("Scheduled site sync every " + interval);
    }

    public List<SyncResult> runOnce() {
        try {
            List<SyncResult> results = syncAll.get();
            LOGGER.info("Scheduled sync finished for " + results.size() + " site(s)");
            return results;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Scheduled sync failed", ex);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "scheduler",
                    "Scheduled sync failed: " + ex.getMessage(),
                    Map.of("interval", interval.toString())
            ));
            return List.of();
        }
    }

    public Duration interval() {
        return interval;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package com.submissionhub.sync.orchestrator;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.core.events.AlertRaised;
import com.submissionhub.core.events.FormSkipped;
import com.submissionhub.core.events.FormSynced;
import com.submissionhub.core.events.SyncCompleted;
import com.submissionhub.core.events.SyncStarted;
import com.submissionhub.core.model.ErrorKind;
import com.submissionhub.core.model.RemoteForm;
import com.submissionhub.core.model.ResolvedForm;
import com.submissionhub.core.model.Site;
import com.submissionhub.core.model.SubmissionDraft;
import com.submissionhub.core.model.SyncResult;
import com.submissionhub.core.model.SyncStatus;
import com.submissionhub.sync.api.SubmissionStore;
import com.submissionhub.sync.error.AuthenticationException;
import com.submissionhub.sync.error.MalformedResponseException;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.error.SyncException;
import com.submissionhub.sync.error.UpsertException;
import com.submissionhub.sync.orchestrator.SiteLockTable.SiteLease;
import com.submissionhub.sync.parse.EntryParser;
import com.submissionhub.sync.remote.EntryPage;
import com.submissionhub.sync.remote.RemoteEntry;
import com.submissionhub.sync.remote.RemoteFormsApi;
import com.submissionhub.sync.resolve.ContactFormResolver;
import com.submissionhub.sync.resolve.FormResolution;
import com.submissionhub.sync.resolve.ResolvedFormCache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class SyncOrchestrator implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SyncOrchestrator.class.getName());

    private final SyncContext ctx;
    private final ContactFormResolver resolver;
    private final EntryParser parser;
    private final SiteLockTable lockTable;
    private final ExecutorService workers;
    private final ConcurrentMap<Long, SyncPhase> phases = new ConcurrentHashMap<>();

    public SyncOrchestrator(SyncContext ctx) {
        this(
                ctx,
                new ContactFormResolver(
                        new ResolvedFormCache(ctx.clock(), ctx.settings().formCacheTtl()),
                        ctx.settings().contactFormTitles()
                ),
                new SiteLockTable()
        );
    }

    public SyncOrchestrator(SyncContext ctx, ContactFormResolver resolver, SiteLockTable lockTable) {
        this.ctx = ctx;
        this.resolver = resolver;
        this.parser = new EntryParser(ctx.clock());
        this.lockTable = lockTable;
        this.workers = Executors.newFixedThreadPool(ctx.settings().workerThreads(), workerThreadFactory());
    }

    /**
     * @throws NotFoundException when the site is unknown or inactive
     */
    public SyncResult syncSite(long siteId) {
        Site site = ctx.siteRepository().find(siteId)
                .filter(Site::active)
                .orElseThrow(() -> new NotFoundException("Site not found"));
        return syncSite(site, "manual");
    }

    public SyncResult syncSite(Site site) {
        return syncSite(site, "manual");
    }

    public List<SyncResult> syncAllSites() {
        List<Site> sites = ctx.siteRepository().activeSites();
        List<Future<SyncResult>> futures = new ArrayList<>();
        for (Site site : sites) {
            futures.add(workers.submit(() -> syncSite(site, "batch")));
        }

        List<SyncResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Site site = sites.get(i);
            Instant startedAt = ctx.clock().instant();
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOGGER.log(Level.SEVERE, "Unexpected failure syncing site " + site.id(), cause);
                ErrorKind kind = cause instanceof SyncException syncException ? syncException.kind() : null;
                results.add(SyncResult.failed(site.id(), kind, "Unexpected error: " + messageOf(cause), startedAt, ctx.clock().instant()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(SyncResult.failed(site.id(), null, "Interrupted while waiting for site sync", startedAt, ctx.clock().instant()));
            }
        }
        return results;
    }

    /**
     * Resolves the site's contact form without syncing.
     *
     * @throws NotFoundException when the site is unknown or no contact form exists
     */
    public ResolvedForm resolveContactForm(long siteId) {
        Site site = ctx.siteRepository().find(siteId)
                .orElseThrow(() -> new NotFoundException("Site not found"));
        RemoteFormsApi api = ctx.apiFactory().open(site, ctx.credentialStore().credentialsFor(site));
        return resolver.resolveContactForm(site, api);
    }

    public SyncPhase phase(long siteId) {
        return phases.getOrDefault(siteId, SyncPhase.IDLE);
    }

    public ContactFormResolver resolver() {
        return resolver;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private SyncResult syncSite(Site site, String trigger) {
        Instant startedAt = ctx.clock().instant();
        Optional<SiteLease> lease = lockTable.tryAcquire(site.id());
        if (lease.isEmpty()) {
            LOGGER.info("Sync already in progress for site " + site.id() + "; skipping " + trigger + " request");
            return SyncResult.inProgress(site.id(), startedAt);
        }

        try (SiteLease ignored = lease.get()) {
            try {
                phases.put(site.id(), SyncPhase.LOCKED);
                ctx.eventBus().publish(new SyncStarted(startedAt, site.id(), trigger));
                SyncResult result;
                try {
                    result = runLocked(site, startedAt);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.SEVERE, "Unexpected failure syncing site " + site.id(), e);
                    ErrorKind kind = e instanceof SyncException syncException ? syncException.kind() : null;
                    result = SyncResult.failed(site.id(), kind, "Unexpected error: " + messageOf(e), startedAt, ctx.clock().instant());
                }
                phases.put(site.id(), terminalPhase(result.status()));
                publishCompletion(result);
                return result;
            } finally {
                // before the lease closes, so a sync that takes the lock next keeps its phase
                phases.remove(site.id());
            }
        }
    }

    private SyncResult runLocked(Site site, Instant startedAt) {
        phases.put(site.id(), SyncPhase.VERIFYING);
        RemoteFormsApi api;
        try {
            api = ctx.apiFactory().open(site, ctx.credentialStore().credentialsFor(site));
            api.verifyCredentials();
        } catch (SyncException e) {
            LOGGER.warning("Credential check failed for site " + site.id() + ": " + e.getMessage());
            return SyncResult.failed(site.id(), e.kind(), e.getMessage(), startedAt, ctx.clock().instant());
        }

        phases.put(site.id(), SyncPhase.SYNCING);
        SyncResult result = syncForms(site, api, startedAt);
        try {
            ctx.siteRepository().markSynced(site.id(), ctx.clock().instant());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not record sync time for site " + site.id(), e);
            return new SyncResult(result.siteId(), result.formsFound(), result.submissionsSynced(), result.formsSkipped(),
                    result.entriesSkipped(), result.status(),
                    result.message() + " (sync time not recorded: " + messageOf(e) + ")",
                    result.errorKind(), result.startedAt(), result.finishedAt());
        }
        return result;
    }

    private SyncResult syncForms(Site site, RemoteFormsApi api, Instant startedAt) {
        FormResolution resolution;
        try {
            resolution = resolver.resolve(site, api);
        } catch (SyncException e) {
            LOGGER.warning("Form discovery failed for site " + site.id() + ": " + e.getMessage());
            return SyncResult.failed(site.id(), e.kind(), e.getMessage(), startedAt, ctx.clock().instant());
        }

        List<FormTarget> targets = new ArrayList<>();
        if (resolution.form().isPresent()) {
            ResolvedForm form = resolution.form().get();
            targets.add(new FormTarget(form.formId(), form.source() == ResolvedForm.Source.CACHED));
        } else {
            for (RemoteForm form : resolution.discoveredForms()) {
                targets.add(new FormTarget(form.id(), false));
            }
            LOGGER.info("No contact form on site " + site.id() + "; syncing all " + targets.size() + " forms");
        }
        if (targets.isEmpty()) {
            return new SyncResult(site.id(), 0, 0, 0, 0, SyncStatus.COMPLETED, "No forms found to sync", null,
                    startedAt, ctx.clock().instant());
        }

        BatchWriter writer = new BatchWriter(ctx.submissionStore(), ctx.settings().batchSize());
        List<FormOutcome> outcomes = new ArrayList<>();
        AuthenticationException authFailure = null;
        try {
            for (FormTarget target : targets) {
                FormOutcome outcome = syncForm(site, api, target, writer);
                outcomes.add(outcome);
                if (outcome.skipped()) {
                    SyncException error = outcome.error();
                    LOGGER.warning("Skipped form " + target.formId() + " on site " + site.id() + ": " + error.getMessage());
                    ctx.eventBus().publish(new FormSkipped(ctx.clock().instant(), site.id(), target.formId(), error.kind(), error.getMessage()));
                    if (error instanceof AuthenticationException authenticationException) {
                        authFailure = authenticationException;
                        break;
                    }
                } else {
                    ctx.eventBus().publish(new FormSynced(
                            ctx.clock().instant(),
                            site.id(),
                            target.formId(),
                            outcome.pagesFetched(),
                            outcome.submissionsSynced(),
                            outcome.entriesSkipped()
                    ));
                }
            }
            writer.finish();
        } catch (UpsertException e) {
            LOGGER.log(Level.WARNING, "Could not commit submissions for site " + site.id(), e);
            return summarize(site, targets.size(), outcomes, startedAt, e);
        }

        return summarize(site, targets.size(), outcomes, startedAt, authFailure);
    }

    private FormOutcome syncForm(Site site, RemoteFormsApi api, FormTarget target, BatchWriter writer) {
        long formId = target.formId();
        int pageSize = ctx.settings().pageSize();
        int maxPages = ctx.settings().maxPages();
        int pages = 0;
        int synced = 0;
        int skipped = 0;

        for (int page = 1; ; page++) {
            if (pages >= maxPages) {
                return FormOutcome.skipped(formId, pages, synced, skipped,
                        new MalformedResponseException("Pagination for form " + formId + " did not end after " + maxPages + " pages"));
            }

            logFormState(site, formId, FormSyncState.FETCHING, page);
            EntryPage entryPage;
            try {
                entryPage = api.fetchEntries(formId, page, pageSize);
            } catch (SyncException e) {
                if (e instanceof NotFoundException && target.fromCache()) {
                    resolver.forget(site);
                }
                return FormOutcome.skipped(formId, pages, synced, skipped, e);
            }
            pages++;

            logFormState(site, formId, FormSyncState.PARSING, page);
            for (RemoteEntry entry : entryPage.entries()) {
                if (entry.id() == null) {
                    skipped++;
                    LOGGER.warning("Skipping entry without id in form " + formId + " on site " + site.id());
                    continue;
                }
                SubmissionDraft draft = new SubmissionDraft(
                        site.id(),
                        entry.id(),
                        formId,
                        entry.status(),
                        entry.response(),
                        parser.parse(entry)
                );
                try {
                    writer.upsert(draft);
                    synced++;
                } catch (UpsertException e) {
                    skipped++;
                    LOGGER.warning("Skipping entry " + draft.key() + ": " + e.getMessage());
                    continue;
                }
                writer.flushIfFull();
            }

            if (entryPage.isLastPage() || entryPage.isEmpty()) {
                return FormOutcome.upserted(formId, pages, synced, skipped);
            }
        }
    }

    private SyncResult summarize(Site site, int formsFound, List<FormOutcome> outcomes, Instant startedAt, SyncException terminal) {
        int synced = 0;
        int entriesSkipped = 0;
        int formsFailed = 0;
        SyncException firstFormError = null;
        for (FormOutcome outcome : outcomes) {
            synced += outcome.submissionsSynced();
            entriesSkipped += outcome.entriesSkipped();
            if (outcome.skipped()) {
                formsFailed++;
                if (firstFormError == null) {
                    firstFormError = outcome.error();
                }
            }
        }
        int formsSkipped = formsFailed + (formsFound - outcomes.size());
        Instant finishedAt = ctx.clock().instant();

        if (terminal != null) {
            return new SyncResult(site.id(), formsFound, synced, formsSkipped, entriesSkipped, SyncStatus.FAILED,
                    terminal.getMessage(), terminal.kind(), startedAt, finishedAt);
        }
        if (formsSkipped == formsFound) {
            return new SyncResult(site.id(), formsFound, synced, formsSkipped, entriesSkipped, SyncStatus.FAILED,
                    firstFormError.getMessage(), firstFormError.kind(), startedAt, finishedAt);
        }

        String synopsis = "Synced " + synced + " submissions from " + formsFound + " form(s)";
        if (formsSkipped == 0 && entriesSkipped == 0) {
            return new SyncResult(site.id(), formsFound, synced, 0, 0, SyncStatus.COMPLETED, synopsis, null,
                    startedAt, finishedAt);
        }

        StringBuilder message = new StringBuilder(synopsis)
                .append("; skipped ").append(formsSkipped).append(" form(s) and ")
                .append(entriesSkipped).append(" entr").append(entriesSkipped == 1 ? "y" : "ies");
        ErrorKind kind;
        if (firstFormError != null) {
            message.append(" (first error: ").append(firstFormError.getMessage()).append(')');
            kind = firstFormError.kind();
        } else {
            kind = ErrorKind.MALFORMED_RESPONSE;
        }
        return new SyncResult(site.id(), formsFound, synced, formsSkipped, entriesSkipped, SyncStatus.PARTIAL_FAILURE,
                message.toString(), kind, startedAt, finishedAt);
    }

    private void publishCompletion(SyncResult result) {
        long durationMillis = Duration.between(result.startedAt(), result.finishedAt()).toMillis();
        EventBus bus = ctx.eventBus();
        bus.publish(new SyncCompleted(
                result.finishedAt(),
                result.siteId(),
                result.status(),
                result.formsFound(),
                result.submissionsSynced(),
                result.message(),
                durationMillis
        ));
        if (result.status() == SyncStatus.FAILED) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("siteId", result.siteId());
            if (result.errorKind() != null) {
                details.put("errorKind", result.errorKind().name());
            }
            bus.publish(new AlertRaised(result.finishedAt(), "sync", result.message(), details));
        }
        LOGGER.info("Site " + result.siteId() + " sync " + result.status() + " in " + durationMillis + " ms: " + result.message());
    }

    private static void logFormState(Site site, long formId, FormSyncState state, int page) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Site " + site.id() + " form " + formId + " " + state + " page " + page);
        }
    }

    private static SyncPhase terminalPhase(SyncStatus status) {
        switch (status) {
            case COMPLETED:
                return SyncPhase.COMPLETED;
            case PARTIAL_FAILURE:
                return SyncPhase.PARTIAL_FAILURE;
            default:
                return SyncPhase.FAILED;
        }
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "site-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record FormTarget(long formId, boolean fromCache) {
    }

    private static final class BatchWriter {
        private final SubmissionStore store;
        private final int batchSize;
        private int pending;

        private BatchWriter(SubmissionStore store, int batchSize) {
            this.store = store;
            this.batchSize = batchSize;
        }

        void upsert(SubmissionDraft draft) {
            store.upsert(draft);
            pending++;
        }

        void flushIfFull() {
            if (pending >= batchSize) {
                store.flush();
                pending = 0;
            }
        }

        void finish() {
            if (pending > 0) {
                store.flush();
                pending = 0;
            }
        }
    }
}

package com.submissionhub.service;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.service.api.ApiServer;
import com.submissionhub.service.api.SyncStatusTracker;
import com.submissionhub.service.config.ConfigLoader;
import com.submissionhub.service.credentials.EnvironmentCredentialStore;
import com.submissionhub.service.http.HttpClientFactory;
import com.submissionhub.service.runtime.SchedulerService;
import com.submissionhub.service.store.EventCodec;
import com.submissionhub.service.store.JsonFileSiteRepository;
import com.submissionhub.service.store.JsonFileSubmissionStore;
import com.submissionhub.service.store.JsonlEventStore;
import com.submissionhub.sync.config.SyncSettings;
import com.submissionhub.sync.diagnostics.SiteDiagnostics;
import com.submissionhub.sync.orchestrator.SyncContext;
import com.submissionhub.sync.orchestrator.SyncOrchestrator;
import com.submissionhub.sync.parse.EntryParser;
import com.submissionhub.sync.read.ContactFormReader;
import com.submissionhub.sync.remote.FluentFormsClientFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final int DEFAULT_API_PORT = 8080;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configDir = Path.of("config");
        Path dataDir = Path.of("data");
        Path eventLogFile = Path.of("logs/events.jsonl");
        Map<String, String> env = System.getenv();
        Clock clock = Clock.systemUTC();

        SyncSettings settings = ConfigLoader.loadSyncSettings(configDir);
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);
        SyncStatusTracker statusTracker = new SyncStatusTracker(eventBus);

        JsonFileSiteRepository siteRepository = new JsonFileSiteRepository(dataDir.resolve("sites.json"));
        JsonFileSubmissionStore submissionStore = new JsonFileSubmissionStore(dataDir.resolve("submissions.json"), clock);
        EnvironmentCredentialStore credentialStore = new EnvironmentCredentialStore(env);
        HttpClient sharedHttpClient = HttpClientFactory.create(settings);
        FluentFormsClientFactory apiFactory = new FluentFormsClientFactory(sharedHttpClient, settings, eventBus, clock);

        SyncContext context = new SyncContext(
                eventBus,
                submissionStore,
                siteRepository,
                credentialStore,
                apiFactory,
                clock,
                settings
        );
        SyncOrchestrator orchestrator = new SyncOrchestrator(context);
        ContactFormReader reader = new ContactFormReader(
                siteRepository,
                credentialStore,
                apiFactory,
                orchestrator.resolver(),
                new EntryParser(clock)
        );
        SiteDiagnostics diagnostics = new SiteDiagnostics(siteRepository, credentialStore, apiFactory);

        SchedulerService scheduler = new SchedulerService(orchestrator::syncAllSites, settings.syncInterval(), eventBus, clock);
        ApiServer apiServer = new ApiServer(
                resolvePort(env, LOGGER::warning),
                orchestrator,
                reader,
                diagnostics,
                eventStore,
                statusTracker
        );

        LOGGER.info("Loaded " + siteRepository.all().size() + " site(s); " + siteRepository.activeSites().size() + " active");
        scheduler.start();
        apiServer.start();
        LOGGER.info("API listening on port " + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            orchestrator.close();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static int resolvePort(Map<String, String> env, Consumer<String> warn) {
        String raw = env.get("API_PORT");
        if (raw == null || raw.isBlank()) {
            return DEFAULT_API_PORT;
        }
        try {
            int port = Integer.parseInt(raw.strip());
            if (port < 0 || port > 65535) {
                warn.accept("API_PORT=" + raw + " is out of range, defaulting to " + DEFAULT_API_PORT);
                return DEFAULT_API_PORT;
            }
            return port;
        } catch (NumberFormatException e) {
            warn.accept("Unknown API_PORT=" + raw + ", defaulting to " + DEFAULT_API_PORT);
            return DEFAULT_API_PORT;
        }
    }
}

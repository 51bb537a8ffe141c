package com.submissionhub.service.api;

import com.submissionhub.core.events.Event;
import com.submissionhub.core.util.JsonUtils;
import com.submissionhub.service.store.EventQuery;
import com.submissionhub.service.store.EventStore;
import com.submissionhub.sync.diagnostics.SiteDiagnostics;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.error.SyncException;
import com.submissionhub.sync.orchestrator.SyncOrchestrator;
import com.submissionhub.sync.read.ContactFormReader;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final SyncOrchestrator orchestrator;
    private final ContactFormReader reader;
    private final SiteDiagnostics diagnostics;
    private final EventStore eventStore;
    private final SyncStatusTracker statusTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            SyncOrchestrator orchestrator,
            ContactFormReader reader,
            SiteDiagnostics diagnostics,
            EventStore eventStore,
            SyncStatusTracker statusTracker
    ) {
        this.port = port;
        this.orchestrator = orchestrator;
        this.reader = reader;
        this.diagnostics = diagnostics;
        this.eventStore = eventStore;
        this.statusTracker = statusTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> guarded(exchange, this::handleHealth));
            server.createContext("/api/sync", exchange -> guarded(exchange, this::handleSync));
            server.createContext("/api/sync/status", exchange -> guarded(exchange, this::handleSyncStatus));
            server.createContext("/api/sites", exchange -> guarded(exchange, this::handleSites));
            server.createContext("/api/diagnostics", exchange -> guarded(exchange, this::handleDiagnostics));
            server.createContext("/api/events", exchange -> guarded(exchange, this::handleEvents));
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server on port " + port, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSync(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        List<String> segments = segmentsAfter(exchange.getRequestURI(), "/api/sync");
        if (segments.isEmpty()) {
            writeJson(exchange, 200, orchestrator.syncAllSites());
            return;
        }
        Optional<Long> siteId = parseId(segments.get(0));
        if (segments.size() != 1 || siteId.isEmpty()) {
            writeError(exchange, 404, "Not found");
            return;
        }
        writeJson(exchange, 200, orchestrator.syncSite(siteId.get()));
    }

    private void handleSyncStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, statusTracker.snapshot());
    }

    private void handleSites(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<String> segments = segmentsAfter(exchange.getRequestURI(), "/api/sites");
        Optional<Long> siteId = segments.isEmpty() ? Optional.empty() : parseId(segments.get(0));
        if (siteId.isEmpty() || segments.size() < 2 || !"contact-form".equals(segments.get(1)) || segments.size() > 3) {
            writeError(exchange, 404, "Not found");
            return;
        }
        if (segments.size() == 2) {
            writeJson(exchange, 200, orchestrator.resolveContactForm(siteId.get()));
            return;
        }
        if (!"entries".equals(segments.get(2))) {
            writeError(exchange, 404, "Not found");
            return;
        }

        int page;
        int perPage;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            page = query.containsKey("page") ? Integer.parseInt(query.get("page")) : 1;
            perPage = query.containsKey("per_page") ? Integer.parseInt(query.get("per_page")) : DEFAULT_PAGE_SIZE;
        } catch (NumberFormatException invalidParamError) {
            writeError(exchange, 400, "page and per_page must be integers");
            return;
        }
        writeJson(exchange, 200, reader.listContactFormEntries(siteId.get(), page, perPage));
    }

    private void handleDiagnostics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<String> segments = segmentsAfter(exchange.getRequestURI(), "/api/diagnostics");
        Optional<Long> siteId = segments.size() == 1 ? parseId(segments.get(0)) : Optional.empty();
        if (siteId.isEmpty()) {
            writeError(exchange, 404, "Not found");
            return;
        }
        writeJson(exchange, 200, diagnostics.runDiagnostics(siteId.get()));
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }

        EventQuery eventQuery;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            eventQuery = new EventQuery(
                    query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH,
                    Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank()),
                    query.containsKey("siteId") ? Optional.of(Long.parseLong(query.get("siteId"))) : Optional.empty(),
                    query.containsKey("limit") ? Math.max(1, Integer.parseInt(query.get("limit"))) : DEFAULT_EVENT_LIMIT
            );
        } catch (RuntimeException invalidParamError) {
            writeError(exchange, 400, "invalid_query_params");
            return;
        }

        List<Event> events = eventStore.query(eventQuery);
        writeJson(exchange, 200, events);
    }

    private void guarded(HttpExchange exchange, ExchangeHandler handler) throws IOException {
        try {
            handler.handle(exchange);
        } catch (NotFoundException e) {
            writeError(exchange, 404, e.getMessage());
        } catch (IllegalArgumentException e) {
            writeError(exchange, 400, e.getMessage());
        } catch (SyncException e) {
            LOGGER.warning("Remote failure serving " + exchange.getRequestURI() + ": " + e.getMessage());
            writeError(exchange, 502, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed serving " + exchange.getRequestURI(), e);
            writeError(exchange, 500, "Internal error");
        } finally {
            exchange.close();
        }
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            exchange.sendResponseHeaders(405, -1);
            return false;
        }
        return true;
    }

    private void writeError(HttpExchange exchange, int status, String message) throws IOException {
        writeJson(exchange, status, Map.of("error", message == null ? "error" : message));
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static List<String> segmentsAfter(URI uri, String prefix) {
        String path = uri.getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        List<String> segments = new ArrayList<>();
        for (String segment : rest.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static Optional<Long> parseId(String segment) {
        try {
            return Optional.of(Long.parseLong(segment));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }
}

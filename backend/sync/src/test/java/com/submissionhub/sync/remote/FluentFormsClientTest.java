package com.submissionhub.sync.remote;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.core.events.RemoteCallRetried;
import com.submissionhub.core.model.RemoteForm;
import com.submissionhub.core.model.Site;
import com.submissionhub.sync.api.Credentials;
import com.submissionhub.sync.error.AuthenticationException;
import com.submissionhub.sync.error.ConnectivityException;
import com.submissionhub.sync.error.MalformedResponseException;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.error.RemoteServerException;
import com.submissionhub.sync.error.RemoteTimeoutException;
import com.submissionhub.sync.retry.RetryListener;
import com.submissionhub.sync.retry.RetryPolicy;
import com.submissionhub.sync.support.EventCapture;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FluentFormsClientTest {
    private static final Credentials CREDENTIALS = new Credentials("sync-bot", "abcd efgh ijkl");
    private static final RetryPolicy NO_SLEEP = new RetryPolicy(
            3, Duration.ofMillis(10), Duration.ofMillis(50), 0.0, RetryPolicy::isTransient, delay -> {
            }, () -> 0.0);

    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void verifyCredentialsSendsBasicAuth() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "{\"id\":3,\"name\":\"sync-bot\"}"));

        RemoteUser user = client().verifyCredentials();

        assertEquals(new RemoteUser(3, "sync-bot"), user);
        assertEquals(List.of("/wp-json/wp/v2/users/me"), requests);
        String expected = "Basic " + Base64.getEncoder()
                .encodeToString("sync-bot:abcd efgh ijkl".getBytes(StandardCharsets.UTF_8));
        assertEquals(List.of(expected), authHeaders);
    }

    @Test
    void listsFormsFromBareAndWrappedLists() throws Exception {
        AtomicInteger call = new AtomicInteger();
        startServer(exchange -> writeResponse(exchange, 200, call.incrementAndGet() == 1
                ? "[{\"id\":1,\"title\":\"Contact\",\"status\":\"published\"},{\"title\":\"no id\"},{\"id\":\"2\",\"title\":\"Quote\"}]"
                : "{\"data\":[{\"id\":5,\"title\":\"Contact Us\"}]}"));
        FluentFormsClient client = client();

        List<RemoteForm> bare = client.listForms();
        List<RemoteForm> wrapped = client.listForms();

        assertEquals(List.of(new RemoteForm(1, "Contact", "published"), new RemoteForm(2, "Quote", null)), bare);
        assertEquals(List.of(new RemoteForm(5, "Contact Us", null)), wrapped);
        assertEquals("/wp-json/fluentform/v1/forms", requests.get(0));
    }

    @Test
    void fetchEntriesReadsPaginationMeta() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "{\"data\":["
                + "{\"id\":10,\"form_id\":11,\"status\":\"read\",\"response\":{\"name\":\"Ada\"},\"created_at\":\"2026-01-15 10:30:00\"},"
                + "{\"id\":\"12\",\"response\":\"{\\\"name\\\":\\\"Bob\\\"}\"}"
                + "],\"meta\":{\"total\":5,\"current_page\":2,\"last_page\":3,\"per_page\":2}}"));

        EntryPage page = client().fetchEntries(11, 2, 2);

        assertEquals(List.of("/wp-json/fluentform/v1/submissions?form_id=11&page=2&per_page=2"), requests);
        assertEquals(new RemoteEntry(10L, 11L, "read", "{\"name\":\"Ada\"}", "2026-01-15 10:30:00"), page.entries().get(0));
        assertEquals(new RemoteEntry(12L, null, null, "{\"name\":\"Bob\"}", null), page.entries().get(1));
        assertEquals(5L, page.totalCount());
        assertEquals(2, page.currentPage());
        assertEquals(3, page.lastPage());
        assertEquals(2, page.perPage());
        assertFalse(page.isLastPage());
    }

    @Test
    void lastPageFallsBackToTotalThenShortPage() throws Exception {
        AtomicInteger call = new AtomicInteger();
        startServer(exchange -> {
            int n = call.incrementAndGet();
            if (n == 1) {
                writeResponse(exchange, 200, "{\"total\":4,\"data\":[{\"id\":3},{\"id\":4}]}");
            } else if (n == 2) {
                writeResponse(exchange, 200, "[{\"id\":1}]");
            } else {
                writeResponse(exchange, 200, "{\"data\":[]}");
            }
        });
        FluentFormsClient client = client();

        assertTrue(client.fetchEntries(11, 2, 2).isLastPage());
        EntryPage shortPage = client.fetchEntries(11, 1, 2);
        assertTrue(shortPage.isLastPage());
        assertNull(shortPage.totalCount());
        assertTrue(client.fetchEntries(11, 9, 2).isEmpty());
    }

    @Test
    void rejectsNonPositivePaging() {
        assertThrows(IllegalArgumentException.class, () -> new FluentFormsClient(
                HttpClient.newHttpClient(), site("http://localhost:1"), CREDENTIALS, Duration.ofSeconds(1), NO_SLEEP,
                RetryListener.NONE).fetchEntries(11, 0, 10));
    }

    @Test
    void unauthorizedIsNotRetried() throws Exception {
        startServer(exchange -> writeResponse(exchange, 401, "{\"code\":\"rest_not_logged_in\"}"));

        AuthenticationException error = assertThrows(AuthenticationException.class, () -> client().verifyCredentials());

        assertEquals("Invalid credentials", error.getMessage());
        assertEquals(1, requests.size());
    }

    @Test
    void missingPluginRouteIsNotFound() throws Exception {
        startServer(exchange -> writeResponse(exchange, 404, "{\"code\":\"rest_no_route\"}"));

        NotFoundException error = assertThrows(NotFoundException.class, () -> client().listForms());

        assertEquals("Fluent Forms plugin not active", error.getMessage());
        assertEquals(1, requests.size());
    }

    @Test
    void serverErrorsAreRetriedAndReportedOnTheBus() throws Exception {
        startServer(exchange -> writeResponse(exchange, 500, "{}"));
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        EventCapture capture = new EventCapture(bus);
        FluentFormsClientFactory factory = new FluentFormsClientFactory(
                HttpClient.newHttpClient(),
                Duration.ofSeconds(2),
                NO_SLEEP,
                bus,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC)
        );

        RemoteServerException error = assertThrows(RemoteServerException.class,
                () -> factory.open(site(baseUrl()), CREDENTIALS).listForms());

        assertEquals(500, error.statusCode());
        assertEquals(3, requests.size());
        List<RemoteCallRetried> retries = capture.byType(RemoteCallRetried.class);
        assertEquals(List.of(1, 2), retries.stream().map(RemoteCallRetried::attempt).toList());
        assertEquals("listForms[site=1]", retries.get(0).operation());
        assertEquals(10L, retries.get(0).delayMillis());
    }

    @Test
    void recoversAfterTransientUnavailability() throws Exception {
        AtomicInteger call = new AtomicInteger();
        startServer(exchange -> {
            if (call.incrementAndGet() == 1) {
                writeResponse(exchange, 503, "{}");
            } else {
                writeResponse(exchange, 200, "[]");
            }
        });

        assertTrue(client().listForms().isEmpty());
        assertEquals(2, requests.size());
    }

    @Test
    void rateLimitHonorsRetryAfterUpToMaxDelay() throws Exception {
        AtomicInteger call = new AtomicInteger();
        startServer(exchange -> {
            if (call.incrementAndGet() == 1) {
                exchange.getResponseHeaders().set("Retry-After", "1");
                writeResponse(exchange, 429, "{}");
            } else {
                writeResponse(exchange, 200, "[]");
            }
        });
        List<Duration> delays = new ArrayList<>();
        FluentFormsClient client = new FluentFormsClient(HttpClient.newHttpClient(), site(baseUrl()), CREDENTIALS,
                Duration.ofSeconds(2), NO_SLEEP, (operation, attempt, delay, cause) -> delays.add(delay));

        client.listForms();

        assertEquals(List.of(Duration.ofMillis(50)), delays);
    }

    @Test
    void invalidJsonIsMalformedAndNotRetried() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "<html>maintenance</html>"));

        assertThrows(MalformedResponseException.class, () -> client().listForms());
        assertEquals(1, requests.size());
    }

    @Test
    void slowResponsesTimeOutOnEveryAttempt() throws Exception {
        startServer(exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, "[]");
        });
        FluentFormsClient client = new FluentFormsClient(HttpClient.newHttpClient(), site(baseUrl()), CREDENTIALS,
                Duration.ofMillis(150), NO_SLEEP, RetryListener.NONE);

        assertThrows(RemoteTimeoutException.class, client::listForms);
        assertEquals(3, requests.size());
    }

    @Test
    void refusedConnectionIsConnectivityFailure() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        FluentFormsClient client = new FluentFormsClient(HttpClient.newHttpClient(), site("http://localhost:" + port),
                CREDENTIALS, Duration.ofSeconds(1), NO_SLEEP, RetryListener.NONE);

        assertThrows(ConnectivityException.class, client::verifyCredentials);
    }

    @Test
    void pluginStatusFindsFluentFormsInListing() throws Exception {
        AtomicInteger call = new AtomicInteger();
        startServer(exchange -> writeResponse(exchange, 200, call.incrementAndGet() == 1
                ? "[{\"name\":\"Akismet\",\"status\":\"active\"},{\"name\":\"Fluent Forms\",\"status\":\"active\",\"version\":\"5.1.0\"}]"
                : "[]"));
        FluentFormsClient client = client();

        assertEquals(new PluginStatus(true, true, "5.1.0"), client.pluginStatus());
        assertEquals(PluginStatus.notInstalled(), client.pluginStatus());
        assertEquals("/wp-json/wp/v2/plugins?search=fluentforms&context=edit", requests.get(0));
    }

    @Test
    void reachabilityChecksReadRestIndexAndNamespace() throws Exception {
        startServer(exchange -> {
            if (exchange.getRequestURI().getPath().endsWith("fluentform/v1")) {
                writeResponse(exchange, 200, "{\"namespace\":\"fluentform/v1\",\"routes\":{}}");
            } else {
                writeResponse(exchange, 200, "{\"name\":\"Main Site\",\"namespaces\":[\"wp/v2\"]}");
            }
        });
        FluentFormsClient client = client();

        assertEquals("Main Site", client.checkSiteReachable());
        assertEquals("fluentform/v1", client.checkPluginNamespace());
        assertEquals(List.of("/wp-json/", "/wp-json/fluentform/v1"), requests);
    }

    private FluentFormsClient client() {
        return new FluentFormsClient(HttpClient.newHttpClient(), site(baseUrl()), CREDENTIALS, Duration.ofSeconds(2),
                NO_SLEEP, RetryListener.NONE);
    }

    private String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort() + "/";
    }

    private static Site site(String baseUrl) {
        return new Site(1, "Main", baseUrl, "main", null, null, true);
    }

    private void startServer(Responder responder) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/", exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            requests.add(exchange.getRequestURI().getPath() + (query == null ? "" : "?" + query));
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            if (auth != null) {
                authHeaders.add(auth);
            }
            responder.respond(exchange);
        });
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Responder {
        void respond(HttpExchange exchange) throws IOException;
    }
}

package com.submissionhub.sync.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.submissionhub.core.model.RemoteForm;
import com.submissionhub.core.model.Site;
import com.submissionhub.core.util.JsonUtils;
import com.submissionhub.sync.api.Credentials;
import com.submissionhub.sync.error.AuthenticationException;
import com.submissionhub.sync.error.ConnectivityException;
import com.submissionhub.sync.error.MalformedResponseException;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.error.RemoteServerException;
import com.submissionhub.sync.error.RemoteStatusException;
import com.submissionhub.sync.error.RemoteTimeoutException;
import com.submissionhub.sync.retry.RetryListener;
import com.submissionhub.sync.retry.RetryPolicy;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

public final class FluentFormsClient implements RemoteFormsApi {
    private static final Logger LOGGER = Logger.getLogger(FluentFormsClient.class.getName());
    private static final String USER_AGENT = "submission-hub/0.1";
    private static final String PLUGIN_NAME = "Fluent Forms";

    private final HttpClient httpClient;
    private final Site site;
    private final String authorization;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final RetryListener retryListener;

    public FluentFormsClient(
            HttpClient httpClient,
            Site site,
            Credentials credentials,
            Duration timeout,
            RetryPolicy retryPolicy,
            RetryListener retryListener
    ) {
        this.httpClient = httpClient;
        this.site = site;
        this.authorization = credentials.basicAuthHeader();
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
        this.retryListener = retryListener;
    }

    @Override
    public RemoteUser verifyCredentials() {
        JsonNode body = getJson("verifyCredentials", "wp/v2/users/me", "REST API not found at " + site.baseUrl());
        if (!body.isObject()) {
            throw new MalformedResponseException("Credential check returned " + body.getNodeType() + " instead of a user");
        }
        return new RemoteUser(body.path("id").asLong(0), body.path("name").asText(""));
    }

    @Override
    public List<RemoteForm> listForms() {
        JsonNode body = getJson("listForms", "fluentform/v1/forms", "Fluent Forms plugin not active");
        JsonNode items = body.isArray() ? body : body.path("data");
        if (!items.isArray()) {
            throw new MalformedResponseException("Forms response is not a list");
        }
        List<RemoteForm> forms = new ArrayList<>();
        for (JsonNode item : items) {
            Long id = optionalLong(item.path("id"));
            if (id == null) {
                LOGGER.warning("Ignoring form without id from site " + site.id());
                continue;
            }
            forms.add(new RemoteForm(id, item.path("title").asText(""), JsonUtils.scalarText(item.path("status"))));
        }
        return forms;
    }

    @Override
    public EntryPage fetchEntries(long formId, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and pageSize must be positive");
        }
        String path = "fluentform/v1/submissions?form_id=" + formId + "&page=" + page + "&per_page=" + pageSize;
        JsonNode body = getJson("fetchEntries[form=" + formId + ",page=" + page + "]", path, "Form " + formId + " not found");

        JsonNode items;
        JsonNode meta;
        if (body.isArray()) {
            items = body;
            meta = JsonUtils.objectMapper().createObjectNode();
        } else if (body.isObject()) {
            items = body.path("data");
            meta = body.path("meta").isObject() ? body.path("meta") : body;
        } else {
            throw new MalformedResponseException("Entries response for form " + formId + " is neither a list nor an object");
        }
        if (!items.isArray()) {
            throw new MalformedResponseException("Entries response for form " + formId + " has no entry list");
        }

        List<RemoteEntry> entries = new ArrayList<>();
        for (JsonNode item : items) {
            entries.add(toEntry(item));
        }

        Long total = firstLong(body.path("total"), meta.path("total"));
        Long current = firstLong(body.path("current_page"), meta.path("current_page"));
        Long last = firstLong(body.path("last_page"), meta.path("last_page"));
        Long perPage = firstLong(body.path("per_page"), meta.path("per_page"));
        int currentPage = current == null ? page : current.intValue();

        boolean isLastPage;
        if (entries.isEmpty()) {
            isLastPage = true;
        } else if (last != null) {
            isLastPage = currentPage >= last;
        } else if (total != null) {
            isLastPage = (long) page * pageSize >= total;
        } else {
            isLastPage = entries.size() < pageSize;
        }

        return new EntryPage(
                entries,
                total,
                currentPage,
                last == null ? null : last.intValue(),
                perPage == null ? null : perPage.intValue(),
                isLastPage
        );
    }

    @Override
    public String checkSiteReachable() {
        JsonNode body = getJson("checkSiteReachable", "", "REST API not found at " + site.baseUrl());
        if (!body.isObject()) {
            throw new MalformedResponseException("REST index is not an object");
        }
        return body.path("name").asText("");
    }

    @Override
    public String checkPluginNamespace() {
        JsonNode body = getJson("checkPluginNamespace", "fluentform/v1", "Fluent Forms REST namespace not found");
        return body.path("namespace").asText("fluentform/v1");
    }

    @Override
    public PluginStatus pluginStatus() {
        JsonNode body = getJson("pluginStatus", "wp/v2/plugins?search=fluentforms&context=edit", "Plugin listing not available");
        if (!body.isArray()) {
            throw new MalformedResponseException("Plugin listing is not a list");
        }
        for (JsonNode plugin : body) {
            if (PLUGIN_NAME.equalsIgnoreCase(plugin.path("name").asText(""))) {
                return new PluginStatus(
                        true,
                        "active".equalsIgnoreCase(plugin.path("status").asText("")),
                        JsonUtils.scalarText(plugin.path("version"))
                );
            }
        }
        return PluginStatus.notInstalled();
    }

    private JsonNode getJson(String operation, String path, String notFoundMessage) {
        URI uri = URI.create(site.baseUrl() + "/wp-json/" + path);
        String qualified = operation + "[site=" + site.id() + "]";
        return retryPolicy.execute(qualified, () -> sendOnce(uri, notFoundMessage), retryListener);
    }

    private JsonNode sendOnce(URI uri, String notFoundMessage) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new RemoteTimeoutException("Request timed out after " + timeout.toMillis() + " ms: " + uri.getPath(), e);
        } catch (IOException e) {
            throw new ConnectivityException(classifyFailureMessage(uri, e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException("Interrupted while calling " + uri.getPath(), e);
        }

        int status = response.statusCode();
        if (status / 100 == 2) {
            try {
                return JsonUtils.objectMapper().readTree(response.body());
            } catch (JsonProcessingException e) {
                throw new MalformedResponseException("Invalid JSON response from " + uri.getPath(), e);
            }
        }
        if (status == 401) {
            throw new AuthenticationException("Invalid credentials");
        }
        if (status == 403) {
            throw new AuthenticationException("Access denied (HTTP 403)");
        }
        if (status == 404) {
            throw new NotFoundException(notFoundMessage);
        }
        if (status == 429 || status >= 500) {
            throw new RemoteServerException(
                    status,
                    "HTTP " + status + " from " + uri.getPath(),
                    retryAfter(response).orElse(null)
            );
        }
        throw new RemoteStatusException(status, "HTTP " + status + " from " + uri.getPath());
    }

    private static Optional<Duration> retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After").flatMap(value -> {
            try {
                return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    private static RemoteEntry toEntry(JsonNode item) {
        if (!item.isObject()) {
            return new RemoteEntry(null, null, null, item.toString(), null);
        }
        JsonNode response = item.path("response");
        String raw;
        if (response.isTextual()) {
            raw = response.asText();
        } else if (response.isMissingNode() || response.isNull()) {
            raw = null;
        } else {
            raw = response.toString();
        }
        return new RemoteEntry(
                optionalLong(item.path("id")),
                optionalLong(item.path("form_id")),
                JsonUtils.scalarText(item.path("status")),
                raw,
                JsonUtils.scalarText(item.path("created_at"))
        );
    }

    private static Long firstLong(JsonNode primary, JsonNode secondary) {
        Long value = optionalLong(primary);
        return value != null ? value : optionalLong(secondary);
    }

    private static Long optionalLong(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String classifyFailureMessage(URI uri, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        String host = uri.getHost();
        if ((host != null && host.endsWith(".invalid"))
                || root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return "DNS/unknown host for " + host + ": " + rootText;
        }
        if (root instanceof ConnectException || lowered.contains("connection refused")) {
            return "Could not connect to " + host;
        }
        return "Connection failure for " + uri.getPath() + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

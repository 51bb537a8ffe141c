package com.submissionhub.sync.remote;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.core.events.RemoteCallRetried;
import com.submissionhub.core.model.Site;
import com.submissionhub.sync.api.Credentials;
import com.submissionhub.sync.config.SyncSettings;
import com.submissionhub.sync.retry.RetryListener;
import com.submissionhub.sync.retry.RetryPolicy;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

public final class FluentFormsClientFactory implements RemoteFormsApiFactory {
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final RetryPolicy retryPolicy;
    private final RetryListener retryListener;

    public FluentFormsClientFactory(HttpClient httpClient, SyncSettings settings, EventBus eventBus, Clock clock) {
        this(httpClient, settings.requestTimeout(), RetryPolicy.from(settings), eventBus, clock);
    }

    public FluentFormsClientFactory(
            HttpClient httpClient,
            Duration requestTimeout,
            RetryPolicy retryPolicy,
            EventBus eventBus,
            Clock clock
    ) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.retryPolicy = retryPolicy;
        this.retryListener = (operation, attempt, delay, cause) -> eventBus.publish(new RemoteCallRetried(
                clock.instant(),
                operation,
                attempt,
                delay.toMillis(),
                cause.getMessage()
        ));
    }

    @Override
    public RemoteFormsApi open(Site site, Credentials credentials) {
        return new FluentFormsClient(httpClient, site, credentials, requestTimeout, retryPolicy, retryListener);
    }
}

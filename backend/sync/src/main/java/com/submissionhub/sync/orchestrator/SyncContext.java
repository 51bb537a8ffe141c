package com.submissionhub.sync.orchestrator;

import com.submissionhub.core.bus.EventBus;
import com.submissionhub.sync.api.CredentialStore;
import com.submissionhub.sync.api.SiteRepository;
import com.submissionhub.sync.api.SubmissionStore;
import com.submissionhub.sync.config.SyncSettings;
import com.submissionhub.sync.remote.RemoteFormsApiFactory;

import java.time.Clock;
import java.util.Objects;

public record SyncContext(
        EventBus eventBus,
        SubmissionStore submissionStore,
        SiteRepository siteRepository,
        CredentialStore credentialStore,
        RemoteFormsApiFactory apiFactory,
        Clock clock,
        SyncSettings settings
) {
    public SyncContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(submissionStore, "submissionStore is required");
        Objects.requireNonNull(siteRepository, "siteRepository is required");
        Objects.requireNonNull(credentialStore, "credentialStore is required");
        Objects.requireNonNull(apiFactory, "apiFactory is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}

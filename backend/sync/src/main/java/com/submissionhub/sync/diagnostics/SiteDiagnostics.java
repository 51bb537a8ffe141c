package com.submissionhub.sync.diagnostics;

import com.submissionhub.core.model.Site;
import com.submissionhub.sync.api.CredentialStore;
import com.submissionhub.sync.api.SiteRepository;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.error.SyncException;
import com.submissionhub.sync.remote.PluginStatus;
import com.submissionhub.sync.remote.RemoteFormsApi;
import com.submissionhub.sync.remote.RemoteFormsApiFactory;

import java.util.logging.Logger;

public final class SiteDiagnostics {
    private static final Logger LOGGER = Logger.getLogger(SiteDiagnostics.class.getName());

    private final SiteRepository siteRepository;
    private final CredentialStore credentialStore;
    private final RemoteFormsApiFactory apiFactory;

    public SiteDiagnostics(SiteRepository siteRepository, CredentialStore credentialStore, RemoteFormsApiFactory apiFactory) {
        this.siteRepository = siteRepository;
        this.credentialStore = credentialStore;
        this.apiFactory = apiFactory;
    }

    public DiagnosticsReport runDiagnostics(long siteId) {
        Site site = siteRepository.find(siteId)
                .orElseThrow(() -> new NotFoundException("Site not found"));

        RemoteFormsApi api;
        try {
            api = apiFactory.open(site, credentialStore.credentialsFor(site));
        } catch (SyncException e) {
            return new DiagnosticsReport(
                    siteId,
                    new DiagnosticsReport.SiteCheck(false, null, e.getMessage()),
                    DiagnosticsReport.PluginApiCheck.skipped(),
                    DiagnosticsReport.PluginCheck.skipped()
            );
        }

        DiagnosticsReport.SiteCheck siteCheck;
        try {
            siteCheck = new DiagnosticsReport.SiteCheck(true, api.checkSiteReachable(), null);
        } catch (SyncException e) {
            LOGGER.info("Site " + siteId + " not reachable: " + e.getMessage());
            return new DiagnosticsReport(
                    siteId,
                    new DiagnosticsReport.SiteCheck(false, null, e.getMessage()),
                    DiagnosticsReport.PluginApiCheck.skipped(),
                    DiagnosticsReport.PluginCheck.skipped()
            );
        }

        DiagnosticsReport.PluginApiCheck apiCheck;
        try {
            api.checkPluginNamespace();
            apiCheck = new DiagnosticsReport.PluginApiCheck(true, null);
        } catch (SyncException e) {
            apiCheck = new DiagnosticsReport.PluginApiCheck(false, e.getMessage());
        }

        DiagnosticsReport.PluginCheck pluginCheck;
        try {
            PluginStatus status = api.pluginStatus();
            pluginCheck = new DiagnosticsReport.PluginCheck(
                    status.installed(),
                    status.active(),
                    status.version(),
                    status.installed() ? null : "Fluent Forms plugin not installed"
            );
        } catch (SyncException e) {
            pluginCheck = new DiagnosticsReport.PluginCheck(false, false, null, e.getMessage());
        }

        return new DiagnosticsReport(siteId, siteCheck, apiCheck, pluginCheck);
    }
}

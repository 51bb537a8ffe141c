package com.submissionhub.sync.remote;

import com.submissionhub.core.model.RemoteForm;
import com.submissionhub.sync.error.SyncException;

import java.util.List;

/**
 * Authenticated access to one site's forms plugin REST surface. Every method either returns a
 * decoded value or throws a {@link SyncException} classifying the failure.
 */
public interface RemoteFormsApi {
    RemoteUser verifyCredentials();

    List<RemoteForm> listForms();

    EntryPage fetchEntries(long formId, int page, int pageSize);

    String checkSiteReachable();

    String checkPluginNamespace();

    PluginStatus pluginStatus();
}

package com.submissionhub.sync.orchestrator;

import com.submissionhub.sync.error.SyncException;

public record FormOutcome(
        long formId,
        FormSyncState state,
        int pagesFetched,
        int submissionsSynced,
        int entriesSkipped,
        SyncException error
) {
    static FormOutcome upserted(long formId, int pagesFetched, int submissionsSynced, int entriesSkipped) {
        return new FormOutcome(formId, FormSyncState.UPSERTED, pagesFetched, submissionsSynced, entriesSkipped, null);
    }

    static FormOutcome skipped(long formId, int pagesFetched, int submissionsSynced, int entriesSkipped, SyncException error) {
        return new FormOutcome(formId, FormSyncState.SKIPPED, pagesFetched, submissionsSynced, entriesSkipped, error);
    }

    public boolean skipped() {
        return state == FormSyncState.SKIPPED;
    }
}

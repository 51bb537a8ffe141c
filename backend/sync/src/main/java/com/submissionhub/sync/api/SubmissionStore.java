package com.submissionhub.sync.api;

import com.submissionhub.core.model.Submission;
import com.submissionhub.core.model.SubmissionDraft;
import com.submissionhub.sync.error.UpsertException;

import java.util.List;
import java.util.Optional;

public interface SubmissionStore {
    /**
     * Inserts a new submission or overwrites the mutable fields of the existing one.
     * Atomic per record: readers never observe a half-applied upsert.
     *
     * @throws UpsertException when the record cannot be written
     */
    UpsertOutcome upsert(SubmissionDraft draft);

    /**
     * Commits everything upserted since the previous flush.
     *
     * @throws UpsertException when the batch cannot be committed
     */
    void flush();

    Optional<Submission> find(long siteId, long remoteEntryId);

    List<Submission> listBySite(long siteId);

    enum UpsertOutcome {
        INSERTED,
        UPDATED
    }
}

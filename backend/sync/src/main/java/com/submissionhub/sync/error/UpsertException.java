package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;
import com.submissionhub.core.model.SubmissionKey;

public class UpsertException extends SyncException {
    private final SubmissionKey key;

    public UpsertException(SubmissionKey key, String message, Throwable cause) {
        super(ErrorKind.UPSERT, message, cause);
        this.key = key;
    }

    public SubmissionKey key() {
        return key;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

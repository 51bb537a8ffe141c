package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public class RemoteStatusException extends SyncException {
    private final int statusCode;

    public RemoteStatusException(int statusCode, String message) {
        super(ErrorKind.REMOTE_STATUS, message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

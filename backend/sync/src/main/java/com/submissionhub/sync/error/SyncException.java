package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public abstract class SyncException extends RuntimeException {
    private final ErrorKind kind;

    protected SyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public abstract boolean retryable();
}

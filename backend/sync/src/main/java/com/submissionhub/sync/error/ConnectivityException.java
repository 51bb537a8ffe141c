package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public class ConnectivityException extends SyncException {
    public ConnectivityException(String message, Throwable cause) {
        super(ErrorKind.CONNECTIVITY, message, cause);
    }

    protected ConnectivityException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

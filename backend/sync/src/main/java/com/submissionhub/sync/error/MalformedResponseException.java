package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public class MalformedResponseException extends SyncException {
    public MalformedResponseException(String message) {
        super(ErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public class AuthenticationException extends SyncException {
    public AuthenticationException(String message) {
        super(ErrorKind.AUTHENTICATION, message);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public class NotFoundException extends SyncException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}

package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

import java.time.Duration;
import java.util.Optional;

public class RemoteServerException extends SyncException {
    private final int statusCode;
    private final Duration retryAfter;

    public RemoteServerException(int statusCode, String message, Duration retryAfter) {
        super(ErrorKind.REMOTE_STATUS, message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public int statusCode() {
        return statusCode;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

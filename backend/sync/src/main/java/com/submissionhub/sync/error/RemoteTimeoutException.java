package com.submissionhub.sync.error;

import com.submissionhub.core.model.ErrorKind;

public class RemoteTimeoutException extends ConnectivityException {
    public RemoteTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}

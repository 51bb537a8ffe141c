package com.submissionhub.core.model;

public enum ErrorKind {
    AUTHENTICATION,
    CONNECTIVITY,
    TIMEOUT,
    REMOTE_STATUS,
    NOT_FOUND,
    MALFORMED_RESPONSE,
    RESOURCE_LOCK,
    UPSERT
}

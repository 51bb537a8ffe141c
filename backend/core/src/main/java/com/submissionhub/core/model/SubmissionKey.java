package com.submissionhub.core.model;

public record SubmissionKey(long siteId, long remoteEntryId) {
    @Override
    public String toString() {
        return siteId + ":" + remoteEntryId;
    }
}

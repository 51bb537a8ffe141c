package com.submissionhub.core.model;

import java.util.Objects;

public record SubmissionDraft(
        long siteId,
        long remoteEntryId,
        long formId,
        String status,
        String rawData,
        ParsedFields parsed
) {
    public SubmissionDraft {
        Objects.requireNonNull(parsed, "parsed is required");
        if (status == null || status.isBlank()) {
            status = Submission.DEFAULT_STATUS;
        }
    }

    public SubmissionKey key() {
        return new SubmissionKey(siteId, remoteEntryId);
    }
}

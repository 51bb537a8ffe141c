package com.submissionhub.core.model;

import java.time.Instant;

// read and active belong to review workflows; sync never writes them.
public record Submission(
        long siteId,
        long remoteEntryId,
        long formId,
        String status,
        String rawData,
        String submitterName,
        String submitterEmail,
        String subject,
        String message,
        Instant submittedAt,
        boolean read,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String DEFAULT_STATUS = "new";

    public static Submission create(SubmissionDraft draft, Instant now) {
        ParsedFields parsed = draft.parsed();
        return new Submission(
                draft.siteId(),
                draft.remoteEntryId(),
                draft.formId(),
                draft.status(),
                draft.rawData(),
                parsed.submitterName().orElse(null),
                parsed.submitterEmail().orElse(null),
                parsed.subject().orElse(null),
                parsed.message().orElse(null),
                parsed.submittedAt(),
                false,
                true,
                now,
                now
        );
    }

    public Submission refreshedFrom(SubmissionDraft draft, Instant now) {
        ParsedFields parsed = draft.parsed();
        return new Submission(
                siteId,
                remoteEntryId,
                formId,
                draft.status(),
                draft.rawData(),
                parsed.submitterName().orElse(null),
                parsed.submitterEmail().orElse(null),
                parsed.subject().orElse(null),
                parsed.message().orElse(null),
                submittedAt,
                read,
                active,
                createdAt,
                now
        );
    }

    public SubmissionKey key() {
        return new SubmissionKey(siteId, remoteEntryId);
    }
}

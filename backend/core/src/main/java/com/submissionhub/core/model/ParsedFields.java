package com.submissionhub.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

// Each field is independent; submittedAt falls back to ingestion time.
public final class ParsedFields {
    private final String submitterName;
    private final String submitterEmail;
    private final String subject;
    private final String message;
    private final Instant submittedAt;
    private final boolean submittedAtFromSource;

    public ParsedFields(
            String submitterName,
            String submitterEmail,
            String subject,
            String message,
            Instant submittedAt,
            boolean submittedAtFromSource
    ) {
        this.submitterName = blankToNull(submitterName);
        this.submitterEmail = blankToNull(submitterEmail);
        this.subject = blankToNull(subject);
        this.message = blankToNull(message);
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt is required");
        this.submittedAtFromSource = submittedAtFromSource;
    }

    public Optional<String> submitterName() {
        return Optional.ofNullable(submitterName);
    }

    public Optional<String> submitterEmail() {
        return Optional.ofNullable(submitterEmail);
    }

    public Optional<String> subject() {
        return Optional.ofNullable(subject);
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public boolean submittedAtFromSource() {
        return submittedAtFromSource;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedFields other)) {
            return false;
        }
        return submittedAtFromSource == other.submittedAtFromSource
                && Objects.equals(submitterName, other.submitterName)
                && Objects.equals(submitterEmail, other.submitterEmail)
                && Objects.equals(subject, other.subject)
                && Objects.equals(message, other.message)
                && submittedAt.equals(other.submittedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(submitterName, submitterEmail, subject, message, submittedAt, submittedAtFromSource);
    }

    @Override
    public String toString() {
        return "ParsedFields{name=" + submitterName + ", email=" + submitterEmail + ", subject=" + subject
                + ", submittedAt=" + submittedAt + (submittedAtFromSource ? "" : " (fallback)") + "}";
    }
}

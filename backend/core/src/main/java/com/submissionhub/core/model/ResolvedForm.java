package com.submissionhub.core.model;

// title is null for pinned forms.
public record ResolvedForm(long formId, String title, Source source) {

    public ResolvedForm withSource(Source next) {
        return new ResolvedForm(formId, title, next);
    }

    public enum Source {
        PINNED,
        CACHED,
        DISCOVERED
    }
}

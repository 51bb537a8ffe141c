package com.submissionhub.sync.read;

import com.submissionhub.core.model.ResolvedForm;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ContactFormEntries(ResolvedForm form, Pagination pagination, List<EntryView> entries) {
    public ContactFormEntries {
        entries = List.copyOf(entries);
    }

    public record Pagination(Long total, int perPage, int currentPage, Integer lastPage) {
    }

    public record EntryView(
            Long id,
            String status,
            String createdAt,
            Map<String, Object> data,
            String submitterName,
            String submitterEmail,
            String subject,
            String message,
            Instant submittedAt
    ) {
    }
}

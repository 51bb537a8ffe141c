package com.submissionhub.sync.remote;

import java.util.List;

// totalCount and lastPage are null when the remote did not report them.
public record EntryPage(
        List<RemoteEntry> entries,
        Long totalCount,
        int currentPage,
        Integer lastPage,
        Integer perPage,
        boolean isLastPage
) {
    public EntryPage {
        entries = List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}

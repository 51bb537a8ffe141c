package com.submissionhub.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.submissionhub.core.model.Submission;
import com.submissionhub.core.model.SubmissionDraft;
import com.submissionhub.core.model.SubmissionKey;
import com.submissionhub.core.util.JsonUtils;
import com.submissionhub.sync.api.SubmissionStore;
import com.submissionhub.sync.error.UpsertException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

// Upserts are visible at once and durable only after flush().
public class JsonFileSubmissionStore implements SubmissionStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<SubmissionKey, Submission> submissions = new LinkedHashMap<>();
    private boolean dirty;

    public JsonFileSubmissionStore(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        loadIfPresent();
    }

    @Override
    public UpsertOutcome upsert(SubmissionDraft draft) {
        lock.lock();
        try {
            SubmissionKey key = draft.key();
            Submission existing = submissions.get(key);
            if (existing == null) {
                submissions.put(key, Submission.create(draft, clock.instant()));
                dirty = true;
                return UpsertOutcome.INSERTED;
            }
            submissions.put(key, existing.refreshedFrom(draft, clock.instant()));
            dirty = true;
            return UpsertOutcome.UPDATED;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            if (!dirty) {
                return;
            }
            persist();
            dirty = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Submission> find(long siteId, long remoteEntryId) {
        lock.lock();
        try {
            return Optional.ofNullable(submissions.get(new SubmissionKey(siteId, remoteEntryId)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Submission> listBySite(long siteId) {
        lock.lock();
        try {
            List<Submission> result = new ArrayList<>();
            for (Submission submission : submissions.values()) {
                if (submission.siteId() == siteId) {
                    result.add(submission);
                }
            }
            result.sort(Comparator.comparing(Submission::submittedAt).reversed());
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return submissions.size();
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                SubmissionsFile loaded = MAPPER.readValue(in, SubmissionsFile.class);
                if (loaded.submissions() != null) {
                    for (Submission submission : loaded.submissions()) {
                        submissions.put(submission.key(), submission);
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading submissions from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            JsonFiles.writeAtomically(file, new SubmissionsFile(new ArrayList<>(submissions.values())));
        } catch (IOException e) {
            throw new UpsertException(null, "Failed writing submissions to " + file, e);
        }
    }

    private record SubmissionsFile(List<Submission> submissions) {
    }
}

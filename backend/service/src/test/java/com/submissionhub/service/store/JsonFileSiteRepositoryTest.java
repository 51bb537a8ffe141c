package com.submissionhub.service.store;

import com.submissionhub.core.model.Site;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileSiteRepositoryTest {
    @Test
    void loadsSitesAndFiltersInactive() throws Exception {
        Path file = writeSites("""
                {
                  "sites": [
                    {"id": 1, "name": "Main", "baseUrl": "https://main.example/", "credentialRef": "main", "active": true},
                    {"id": 2, "name": "Old", "baseUrl": "https://old.example", "credentialRef": "old", "contactFormId": 7, "active": false}
                  ]
                }
                """);

        JsonFileSiteRepository repository = new JsonFileSiteRepository(file);

        assertEquals(2, repository.all().size());
        assertEquals(List.of(1L), repository.activeSites().stream().map(Site::id).toList());
        Site main = repository.find(1).orElseThrow();
        assertEquals("https://main.example", main.baseUrl());
        assertNull(main.contactFormId());
        assertEquals(7L, repository.find(2).orElseThrow().contactFormId());
        assertTrue(repository.find(3).isEmpty());
    }

    @Test
    void markSyncedPersistsTimestamp() throws Exception {
        Path file = writeSites("""
                {"sites": [{"id": 1, "name": "Main", "baseUrl": "https://main.example", "credentialRef": "main", "active": true}]}
                """);
        JsonFileSiteRepository repository = new JsonFileSiteRepository(file);

        repository.markSynced(1, Instant.parse("2026-03-02T10:00:00Z"));

        JsonFileSiteRepository reloaded = new JsonFileSiteRepository(file);
        assertEquals(Instant.parse("2026-03-02T10:00:00Z"), reloaded.find(1).orElseThrow().lastSyncedAt());
        assertEquals("main", reloaded.find(1).orElseThrow().credentialRef());
        assertFalse(Files.exists(file.resolveSibling("sites.json.tmp")));
    }

    @Test
    void failedWriteLeavesTheRegistryIntact() throws Exception {
        String original = """
                {"sites": [{"id": 1, "name": "Main", "baseUrl": "https://main.example", "credentialRef": "main", "active": true}]}
                """;
        Path file = writeSites(original);
        JsonFileSiteRepository repository = new JsonFileSiteRepository(file);
        Files.createDirectory(file.resolveSibling("sites.json.tmp"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> repository.markSynced(1, Instant.parse("2026-03-02T10:00:00Z")));

        assertTrue(error.getMessage().contains(file.toString()));
        assertEquals(original, Files.readString(file));
        assertNull(new JsonFileSiteRepository(file).find(1).orElseThrow().lastSyncedAt());
    }

    @Test
    void nonHttpBaseUrlFailsLoadWithPath() throws Exception {
        Path file = writeSites("""
                {"sites": [{"id": 1, "name": "Files", "baseUrl": "ftp://example.com", "credentialRef": "files", "active": true}]}
                """);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new JsonFileSiteRepository(file));

        assertTrue(error.getMessage().contains(file.toString()));
    }

    @Test
    void markSyncedRejectsUnknownSite() throws Exception {
        Path file = writeSites("{\"sites\": []}");
        JsonFileSiteRepository repository = new JsonFileSiteRepository(file);

        assertThrows(IllegalStateException.class, () -> repository.markSynced(9, Instant.EPOCH));
    }

    @Test
    void duplicateIdsAndInvalidJsonFailFastWithPath() throws Exception {
        Path duplicate = writeSites("""
                {"sites": [{"id": 1, "baseUrl": "https://a.example"}, {"id": 1, "baseUrl": "https://b.example"}]}
                """);
        Path invalid = writeSites("{\"sites\": [");

        IllegalStateException duplicateError = assertThrows(IllegalStateException.class,
                () -> new JsonFileSiteRepository(duplicate));
        IllegalStateException invalidError = assertThrows(IllegalStateException.class,
                () -> new JsonFileSiteRepository(invalid));

        assertTrue(duplicateError.getMessage().contains("Duplicate site id 1"));
        assertTrue(invalidError.getMessage().contains(invalid.toString()));
    }

    @Test
    void missingFileMeansNoSites() throws Exception {
        Path file = Files.createTempDirectory("site-repository-").resolve("sites.json");

        assertTrue(new JsonFileSiteRepository(file).all().isEmpty());
    }

    private static Path writeSites(String json) throws Exception {
        Path file = Files.createTempDirectory("site-repository-").resolve("sites.json");
        Files.writeString(file, json);
        return file;
    }
}

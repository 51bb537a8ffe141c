package com.submissionhub.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.submissionhub.core.util.JsonUtils;
import com.submissionhub.sync.config.SyncSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static SyncSettings loadSyncSettings(Path configDir) {
        Path path = configDir.resolve("sync.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + "; using default sync settings");
            return SyncSettings.defaults();
        }
        SyncConfigFile file = read(path, new TypeReference<>() {
        });
        return file.toSettings();
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    record SyncConfigFile(
            Long requestTimeoutSeconds,
            Integer maxAttempts,
            Long retryBaseDelayMillis,
            Long retryMaxDelayMillis,
            Double retryJitter,
            Integer pageSize,
            Integer batchSize,
            Integer maxPages,
            Long formCacheTtlSeconds,
            Integer workerThreads,
            List<String> contactFormTitles,
            Long syncIntervalMinutes
    ) {
        SyncSettings toSettings() {
            return new SyncSettings(
                    requestTimeoutSeconds == null ? null : Duration.ofSeconds(requestTimeoutSeconds),
                    orZero(maxAttempts),
                    retryBaseDelayMillis == null ? null : Duration.ofMillis(retryBaseDelayMillis),
                    retryMaxDelayMillis == null ? null : Duration.ofMillis(retryMaxDelayMillis),
                    retryJitter,
                    orZero(pageSize),
                    orZero(batchSize),
                    orZero(maxPages),
                    formCacheTtlSeconds == null ? null : Duration.ofSeconds(formCacheTtlSeconds),
                    orZero(workerThreads),
                    contactFormTitles,
                    syncIntervalMinutes == null ? null : Duration.ofMinutes(syncIntervalMinutes)
            );
        }

        private static int orZero(Integer value) {
            return value == null ? 0 : value;
        }
    }
}

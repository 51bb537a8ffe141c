package com.submissionhub.sync.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.submissionhub.core.model.ParsedFields;
import com.submissionhub.core.util.JsonUtils;
import com.submissionhub.sync.remote.RemoteEntry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

// Never throws; each unreadable field is left empty on its own.
public final class EntryParser {
    private static final Logger LOGGER = Logger.getLogger(EntryParser.class.getName());

    private final Clock clock;

    public EntryParser(Clock clock) {
        this.clock = clock;
    }

    public ParsedFields parse(RemoteEntry entry) {
        Optional<ObjectNode> payload = JsonUtils.parseObject(entry.response());
        Instant ingestedAt = clock.instant();
        Instant submittedAt = parseTimestamp(entry.createdAt()).orElse(null);
        if (submittedAt == null && entry.createdAt() != null) {
            LOGGER.fine("Unparsable created_at '" + entry.createdAt() + "' on entry " + entry.id());
        }

        if (payload.isEmpty()) {
            return new ParsedFields(null, null, null, null,
                    submittedAt != null ? submittedAt : ingestedAt, submittedAt != null);
        }
        ObjectNode fields = payload.get();
        return new ParsedFields(
                submitterName(fields),
                firstText(fields, "email", "email_address"),
                firstText(fields, "subject"),
                firstText(fields, "message", "comments"),
                submittedAt != null ? submittedAt : ingestedAt,
                submittedAt != null
        );
    }

    public Map<String, Object> cleanedData(String response) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        Optional<ObjectNode> payload = JsonUtils.parseObject(response);
        if (payload.isEmpty()) {
            return cleaned;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = payload.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().startsWith("_")) {
                continue;
            }
            cleaned.put(field.getKey(), JsonUtils.objectMapper().convertValue(field.getValue(), Object.class));
        }
        return cleaned;
    }

    static Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.strip();
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // not an offset timestamp; WordPress usually sends local "yyyy-MM-dd HH:mm:ss"
        }
        try {
            return Optional.of(LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    private static String submitterName(ObjectNode fields) {
        JsonNode names = fields.path("names");
        if (names.isObject()) {
            String first = textOrEmpty(names.path("first_name"));
            String last = textOrEmpty(names.path("last_name"));
            String joined = (first + " " + last).strip();
            if (!joined.isEmpty()) {
                return joined;
            }
        } else if (names.isTextual() && !names.asText().isBlank()) {
            return names.asText();
        }
        return firstText(fields, "name", "full_name");
    }

    private static String firstText(ObjectNode fields, String... keys) {
        for (String key : keys) {
            String value = JsonUtils.scalarText(fields.get(key));
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String textOrEmpty(JsonNode node) {
        String value = JsonUtils.scalarText(node);
        return value == null ? "" : value.strip();
    }
}

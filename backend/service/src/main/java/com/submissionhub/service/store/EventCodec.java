package com.submissionhub.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.submissionhub.core.bus.EventBus;
import com.submissionhub.core.events.AlertRaised;
import com.submissionhub.core.events.Event;
import com.submissionhub.core.events.FormSkipped;
import com.submissionhub.core.events.FormSynced;
import com.submissionhub.core.events.RemoteCallRetried;
import com.submissionhub.core.events.SyncCompleted;
import com.submissionhub.core.events.SyncStarted;
import com.submissionhub.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "SyncStarted", SyncStarted.class,
            "SyncCompleted", SyncCompleted.class,
            "FormSynced", FormSynced.class,
            "FormSkipped", FormSkipped.class,
            "RemoteCallRetried", RemoteCallRetried.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(allEventTypes(), consumer);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}

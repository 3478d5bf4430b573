package com.p14n.eventbus.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single "something happened" notification carried by the event bus.
 *
 * <p>
 * All fields are fixed at construction apart from the payload, which the
 * producer may replace until the message is published. Publishing freezes the
 * message, after which {@link #setPayload(Object)} fails.
 * </p>
 *
 * <p>
 * The timestamp is held at millisecond precision so that {@link #key()} and the
 * serialized form describe exactly the same instant.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted",
 *         EventMessageLevel.INFO, EventMessageSeverity.NORMAL, Map.of("id", "42"));
 * msg.group(); // Optional[n8n.workflow]
 * msg.key(); // 1700000000000-0b5c...
 * }</pre>
 */
public final class EventMessage implements Traceable {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final String id;
    private final Instant timestamp;
    private final String eventName;
    private final EventMessageLevel level;
    private final EventMessageSeverity severity;
    private final AtomicBoolean frozen = new AtomicBoolean(false);
    private volatile JsonNode payload;

    private EventMessage(String id, Instant timestamp, String eventName, EventMessageLevel level,
            EventMessageSeverity severity, JsonNode payload) {
        this.id = id;
        this.timestamp = timestamp;
        this.eventName = eventName;
        this.level = level;
        this.severity = severity;
        this.payload = payload;
    }

    public static EventMessage create(String eventName) {
        return create(eventName, EventMessageLevel.INFO, EventMessageSeverity.NORMAL, null);
    }

    public static EventMessage create(String eventName, Object payload) {
        return create(eventName, EventMessageLevel.INFO, EventMessageSeverity.NORMAL, payload);
    }

    public static EventMessage create(String eventName, EventMessageLevel level, EventMessageSeverity severity,
            Object payload) {
        return create(UUID.randomUUID().toString(), Instant.now(), eventName, level, severity, payload);
    }

    /**
     * Creates an event message with every field supplied by the caller.
     * Used when restoring stored messages.
     *
     * @throws IllegalArgumentException if id or eventName are null or empty, if
     *                                  timestamp is null or if the payload
     *                                  cannot be converted to JSON
     */
    public static EventMessage create(String id, Instant timestamp, String eventName, EventMessageLevel level,
            EventMessageSeverity severity, Object payload) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (eventName == null || eventName.trim().isEmpty()) {
            throw new IllegalArgumentException("eventName cannot be null or empty");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (timestamp.toEpochMilli() < 0) {
            throw new IllegalArgumentException("timestamp cannot be before the epoch");
        }
        return new EventMessage(id,
                timestamp.truncatedTo(ChronoUnit.MILLIS),
                eventName,
                level == null ? EventMessageLevel.INFO : level,
                severity == null ? EventMessageSeverity.NORMAL : severity,
                toPayloadNode(payload));
    }

    @Override
    public String id() {
        return id;
    }

    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public String eventName() {
        return eventName;
    }

    public EventMessageLevel level() {
        return level;
    }

    public EventMessageSeverity severity() {
        return severity;
    }

    /**
     * @return a copy of the payload, never null
     */
    public JsonNode payload() {
        return payload.deepCopy();
    }

    /**
     * Replaces the payload.
     *
     * @throws IllegalStateException if the message has already been published
     */
    public void setPayload(Object payload) {
        if (frozen.get()) {
            throw new IllegalStateException("Payload cannot change after the message is published");
        }
        this.payload = toPayloadNode(payload);
    }

    /**
     * Prevents further payload changes. Called by the bus on publish.
     */
    public void freeze() {
        frozen.set(true);
    }

    public boolean isFrozen() {
        return frozen.get();
    }

    /**
     * The leading two dot-segments of the event name, e.g. {@code n8n.workflow}
     * for {@code n8n.workflow.workflowStarted}.
     *
     * @return the group, or empty when the name has fewer than two segments
     */
    public Optional<String> group() {
        int first = eventName.indexOf('.');
        if (first <= 0 || first == eventName.length() - 1) {
            return Optional.empty();
        }
        int second = eventName.indexOf('.', first + 1);
        if (second == first + 1) {
            return Optional.empty();
        }
        return Optional.of(second < 0 ? eventName : eventName.substring(0, second));
    }

    @Override
    public String key() {
        return keyFor(timestamp, id);
    }

    /**
     * Builds the storage key: epoch millis zero-padded to 13 digits, a dash,
     * then the id. Keys sort lexicographically in time order.
     */
    public static String keyFor(Instant timestamp, String id) {
        return String.format("%013d-%s", timestamp.toEpochMilli(), id);
    }

    /**
     * Extracts the epoch millis encoded at the front of a storage key.
     *
     * @throws IllegalArgumentException if the key has no numeric prefix
     */
    public static long timestampOfKey(String key) {
        int dash = key == null ? -1 : key.indexOf('-');
        if (dash <= 0) {
            throw new IllegalArgumentException("Not an event message key: " + key);
        }
        try {
            return Long.parseLong(key.substring(0, dash));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an event message key: " + key, e);
        }
    }

    /**
     * Serializes the message. The payload is written as a JSON string holding
     * the payload document rather than as a nested object.
     */
    public String toJson() {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", id);
        node.put("ts", timestamp.toString());
        node.put("eventName", eventName);
        node.put("level", level.value());
        node.put("severity", severity.value());
        node.put("payload", payload.toString());
        return node.toString();
    }

    /**
     * Restores a message written by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if the text is not a serialized event
     *                                  message
     */
    public static EventMessage fromJson(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event message is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Event message must be a JSON object");
        }
        try {
            return create(requiredText(node, "id"),
                    Instant.parse(requiredText(node, "ts")),
                    requiredText(node, "eventName"),
                    node.hasNonNull("level") ? EventMessageLevel.fromValue(node.get("level").asText()) : null,
                    node.hasNonNull("severity") ? EventMessageSeverity.fromValue(node.get("severity").asText())
                            : null,
                    readPayload(node.get("payload")));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Event message has an invalid timestamp", e);
        }
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Event message is missing " + field);
        }
        return value.asText();
    }

    private static JsonNode readPayload(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            return value;
        }
        try {
            return mapper.readTree(value.asText());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event message payload is not valid JSON", e);
        }
    }

    private static JsonNode toPayloadNode(Object payload) {
        if (payload == null) {
            return mapper.createObjectNode();
        }
        if (payload instanceof JsonNode) {
            return ((JsonNode) payload).deepCopy();
        }
        return mapper.valueToTree(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventMessage)) {
            return false;
        }
        EventMessage other = (EventMessage) o;
        return id.equals(other.id)
                && timestamp.equals(other.timestamp)
                && eventName.equals(other.eventName)
                && level == other.level
                && severity == other.severity
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp);
    }

    @Override
    public String toString() {
        return toJson();
    }
}

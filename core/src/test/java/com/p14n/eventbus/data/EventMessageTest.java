package com.p14n.eventbus.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventMessageTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldApplyDefaults() {
        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted");

        assertNotNull(msg.id());
        assertEquals(EventMessageLevel.INFO, msg.level());
        assertEquals(EventMessageSeverity.NORMAL, msg.severity());
        assertTrue(msg.payload().isObject());
        assertEquals(0, msg.payload().size());
        assertFalse(msg.isFrozen());
    }

    @Test
    void shouldRejectMissingName() {
        assertThrows(IllegalArgumentException.class, () -> EventMessage.create(""));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.create(null));
    }

    @Test
    void shouldRejectTimestampBeforeEpoch() {
        assertThrows(IllegalArgumentException.class, () -> EventMessage.create("id", Instant.ofEpochMilli(-1),
                "n8n.core.x", null, null, null));
    }

    @Test
    void groupIsFirstTwoSegments() {
        assertEquals(Optional.of("n8n.workflow"), EventMessage.create("n8n.workflow.workflowStarted").group());
        assertEquals(Optional.of("n8n.audit"), EventMessage.create("n8n.audit").group());
        assertEquals(Optional.empty(), EventMessage.create("standalone").group());
        assertEquals(Optional.empty(), EventMessage.create("n8n..broken").group());
    }

    @Test
    void keyIsZeroPaddedMillisAndId() {
        EventMessage msg = EventMessage.create("abc", Instant.ofEpochMilli(42), "n8n.core.test", null, null, null);

        assertEquals("0000000000042-abc", msg.key());
        assertEquals(42L, EventMessage.timestampOfKey(msg.key()));
    }

    @Test
    void timestampIsTruncatedToMillis() {
        EventMessage msg = EventMessage.create("abc", Instant.ofEpochSecond(1, 123_456_789), "n8n.core.test",
                null, null, null);

        assertEquals(Instant.ofEpochMilli(1123), msg.timestamp());
        assertEquals("0000000001123-abc", msg.key());
    }

    @Test
    void timestampOfKeyRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> EventMessage.timestampOfKey("nodash"));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.timestampOfKey("abc-def"));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.timestampOfKey(null));
    }

    @Test
    void shouldRoundTripThroughJson() {
        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted", EventMessageLevel.ERROR,
                EventMessageSeverity.HIGHEST, Map.of("id", "42", "nested", Map.of("count", 3)));

        EventMessage restored = EventMessage.fromJson(msg.toJson());

        assertEquals(msg, restored);
        assertEquals(msg.key(), restored.key());
        assertEquals(3, restored.payload().get("nested").get("count").asInt());
    }

    @Test
    void payloadIsWrittenAsString() throws Exception {
        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "42"));

        JsonNode node = mapper.readTree(msg.toJson());

        assertTrue(node.get("payload").isTextual());
        assertEquals("42", mapper.readTree(node.get("payload").asText()).get("id").asText());
        assertEquals("info", node.get("level").asText());
        assertEquals("normal", node.get("severity").asText());
    }

    @Test
    void fromJsonAcceptsObjectPayloadAndMissingPayload() {
        EventMessage withObject = EventMessage.fromJson("{\"id\":\"a\",\"ts\":\"2023-01-01T00:00:00Z\","
                + "\"eventName\":\"n8n.core.test\",\"payload\":{\"x\":1}}");
        EventMessage withoutPayload = EventMessage.fromJson("{\"id\":\"b\",\"ts\":\"2023-01-01T00:00:00Z\","
                + "\"eventName\":\"n8n.core.test\"}");

        assertEquals(1, withObject.payload().get("x").asInt());
        assertEquals(0, withoutPayload.payload().size());
        assertEquals(EventMessageLevel.INFO, withoutPayload.level());
    }

    @Test
    void fromJsonRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> EventMessage.fromJson("not json"));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.fromJson("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.fromJson("{\"id\":\"a\"}"));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.fromJson(
                "{\"id\":\"a\",\"ts\":\"yesterday\",\"eventName\":\"n8n.core.test\"}"));
        assertThrows(IllegalArgumentException.class, () -> EventMessage.fromJson(
                "{\"id\":\"a\",\"ts\":\"2023-01-01T00:00:00Z\",\"eventName\":\"n8n.core.test\",\"level\":\"loud\"}"));
    }

    @Test
    void payloadCannotChangeAfterFreeze() {
        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "1"));
        msg.setPayload(Map.of("id", "2"));
        assertEquals("2", msg.payload().get("id").asText());

        msg.freeze();

        assertThrows(IllegalStateException.class, () -> msg.setPayload(Map.of("id", "3")));
        assertEquals("2", msg.payload().get("id").asText());
    }

    @Test
    void payloadAccessorReturnsCopy() {
        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "1"));

        ((com.fasterxml.jackson.databind.node.ObjectNode) msg.payload()).put("id", "changed");

        assertEquals("1", msg.payload().get("id").asText());
    }
}

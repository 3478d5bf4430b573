package com.p14n.eventbus.data;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.Chars;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;
import net.jqwik.api.constraints.Whitespace;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventMessagePropertiesTest {

    @Property(tries = 500)
    void keysSortInTimeOrder(@ForAll @LongRange(min = 0, max = 9_999_999_999_999L) long first,
            @ForAll @LongRange(min = 0, max = 9_999_999_999_999L) long second) {
        String firstKey = EventMessage.keyFor(Instant.ofEpochMilli(first), UUID.randomUUID().toString());
        String secondKey = EventMessage.keyFor(Instant.ofEpochMilli(second), UUID.randomUUID().toString());

        if (first < second) {
            assertTrue(firstKey.compareTo(secondKey) < 0);
        } else if (first > second) {
            assertTrue(firstKey.compareTo(secondKey) > 0);
        }
        assertEquals(first, EventMessage.timestampOfKey(firstKey));
    }

    @Property(tries = 200)
    void serializedFormIsLossless(@ForAll @AlphaChars @StringLength(min = 1, max = 20) String group,
            @ForAll @AlphaChars @StringLength(min = 1, max = 20) String name,
            @ForAll @AlphaChars @NumericChars @Whitespace @Chars({ '"', '\\', '{', '}', 'é' }) String value,
            @ForAll EventMessageLevel level,
            @ForAll EventMessageSeverity severity) {
        EventMessage msg = EventMessage.create("n8n." + group + "." + name, level, severity,
                Map.of("value", value));

        EventMessage restored = EventMessage.fromJson(msg.toJson());

        assertEquals(msg, restored);
        assertEquals(msg.key(), restored.key());
        assertEquals(msg.group(), restored.group());
    }
}

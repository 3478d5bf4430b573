package com.p14n.eventbus.data;

/**
 * Business impact of an event message.
 */
public enum EventMessageSeverity {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    HIGHEST("highest");

    private final String value;

    EventMessageSeverity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EventMessageSeverity fromValue(String value) {
        for (EventMessageSeverity severity : values()) {
            if (severity.value.equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown event message severity: " + value);
    }
}

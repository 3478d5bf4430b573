package com.p14n.eventbus.data;

/**
 * Logging severity of an event message.
 */
public enum EventMessageLevel {
    DEBUG("debug"),
    VERBOSE("verbose"),
    INFO("info"),
    ERROR("error");

    private final String value;

    EventMessageLevel(String value) {
        this.value = value;
    }

    /**
     * @return the serialized form of this level
     */
    public String value() {
        return value;
    }

    public static EventMessageLevel fromValue(String value) {
        for (EventMessageLevel level : values()) {
            if (level.value.equals(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown event message level: " + value);
    }
}

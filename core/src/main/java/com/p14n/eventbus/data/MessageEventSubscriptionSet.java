package com.p14n.eventbus.data;

import java.util.Arrays;
import java.util.Set;

/**
 * A named filter deciding which event messages a receiver gets.
 * A message matches when its group is one of {@code eventGroups} or its name is
 * one of {@code eventNames}.
 *
 * <pre>{@code
 * var workflows = MessageEventSubscriptionSet.ofGroups("workflows", "n8n.workflow");
 * var startup = MessageEventSubscriptionSet.ofNames("startup", "n8n.core.started");
 * }</pre>
 *
 * @param name        identifies the set when merging or removing sets
 * @param eventGroups groups to match, e.g. {@code n8n.workflow}
 * @param eventNames  exact event names to match
 */
public record MessageEventSubscriptionSet(String name, Set<String> eventGroups, Set<String> eventNames) {

    public MessageEventSubscriptionSet {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Subscription set name cannot be null or empty");
        }
        eventGroups = eventGroups == null ? Set.of() : Set.copyOf(eventGroups);
        eventNames = eventNames == null ? Set.of() : Set.copyOf(eventNames);
    }

    public static MessageEventSubscriptionSet ofGroups(String name, String... eventGroups) {
        return new MessageEventSubscriptionSet(name, Set.copyOf(Arrays.asList(eventGroups)), Set.of());
    }

    public static MessageEventSubscriptionSet ofNames(String name, String... eventNames) {
        return new MessageEventSubscriptionSet(name, Set.of(), Set.copyOf(Arrays.asList(eventNames)));
    }

    public boolean matches(EventMessage message) {
        return message.group().map(eventGroups::contains).orElse(false)
                || eventNames.contains(message.eventName());
    }
}

package com.p14n.eventbus.data;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MessageEventSubscriptionSetTest {

    @Test
    void matchesByGroup() {
        var set = MessageEventSubscriptionSet.ofGroups("workflows", "n8n.workflow");

        assertTrue(set.matches(EventMessage.create("n8n.workflow.workflowStarted")));
        assertFalse(set.matches(EventMessage.create("n8n.audit.userSignedUp")));
    }

    @Test
    void matchesByName() {
        var set = MessageEventSubscriptionSet.ofNames("startup", "n8n.core.eventBusInitialized");

        assertTrue(set.matches(EventMessage.create("n8n.core.eventBusInitialized")));
        assertFalse(set.matches(EventMessage.create("n8n.core.somethingElse")));
    }

    @Test
    void groupOrNameIsEnough() {
        var set = new MessageEventSubscriptionSet("mixed", Set.of("n8n.workflow"), Set.of("standalone"));

        assertTrue(set.matches(EventMessage.create("n8n.workflow.workflowFailed")));
        assertTrue(set.matches(EventMessage.create("standalone")));
        assertFalse(set.matches(EventMessage.create("n8n.node.nodeStarted")));
    }

    @Test
    void messageWithoutGroupOnlyMatchesByName() {
        var set = MessageEventSubscriptionSet.ofGroups("groups", "standalone");

        assertFalse(set.matches(EventMessage.create("standalone")));
    }

    @Test
    void emptySetMatchesNothing() {
        var set = new MessageEventSubscriptionSet("empty", null, null);

        assertFalse(set.matches(EventMessage.create("n8n.workflow.workflowStarted")));
        assertTrue(set.eventGroups().isEmpty());
    }

    @Test
    void duplicatesAreAllowed() {
        var set = MessageEventSubscriptionSet.ofGroups("dups", "n8n.workflow", "n8n.workflow");

        assertEquals(Set.of("n8n.workflow"), set.eventGroups());
    }

    @Test
    void nameIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> MessageEventSubscriptionSet.ofGroups(" ", "a.b"));
    }
}

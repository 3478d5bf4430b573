package com.p14n.eventbus.bus;

import com.p14n.eventbus.broker.MessageForwarderToLocalBroker;
import com.p14n.eventbus.data.EventMessage;
import com.p14n.eventbus.data.EventMessageLevel;
import com.p14n.eventbus.data.MessageEventSubscriptionSet;
import com.p14n.eventbus.errors.WriteException;
import com.p14n.eventbus.receiver.MessageEventSubscriptionReceiver;
import com.p14n.eventbus.store.InMemoryMessageEventBusWriter;
import com.p14n.eventbus.store.MessageEventBusWriter;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class MessageEventBusTest {

    private MessageEventBus bus;
    private InMemoryMessageEventBusWriter writer;

    /** Records every message and answers with a fixed verdict. */
    static class RecordingForwarder implements MessageEventBusForwarder {
        final List<EventMessage> forwarded = new CopyOnWriteArrayList<>();
        final boolean accept;
        boolean closed;

        RecordingForwarder(boolean accept) {
            this.accept = accept;
        }

        @Override
        public boolean forward(EventMessage message) {
            forwarded.add(message);
            return accept;
        }

        @Override
        public void close() {
            closed = true;
        }

        List<String> names() {
            return forwarded.stream().map(EventMessage::eventName).collect(Collectors.toList());
        }
    }

    @BeforeEach
    void setUp() {
        bus = new MessageEventBus(OpenTelemetry.noop());
        writer = new InMemoryMessageEventBusWriter();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void initializePublishesStartupEvent() {
        RecordingForwarder forwarder = new RecordingForwarder(false);

        bus.initialize(List.of(writer), List.of(forwarder));

        List<EventMessage> unsent = bus.getEventsUnsent();
        assertEquals(1, unsent.size());
        assertEquals(MessageEventBus.EVENT_BUS_INITIALIZED, unsent.get(0).eventName());
        assertEquals(EventMessageLevel.DEBUG, unsent.get(0).level());
        assertEquals(MessageEventBus.EVENT_BUS_INITIALIZED, forwarder.names().get(0));
    }

    @Test
    void deliversAndConfirmsThroughLocalBroker() throws InterruptedException {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        MessageForwarderToLocalBroker forwarder = new MessageForwarderToLocalBroker(OpenTelemetry.noop())
                .addReceiver(new MessageEventSubscriptionReceiver("console", () -> received::add),
                        MessageEventSubscriptionSet.ofGroups("workflows", "n8n.workflow"));
        bus.initialize(List.of(writer), List.of(forwarder));

        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "42"));
        bus.publish(msg);

        String delivered = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(delivered);
        assertEquals(msg, EventMessage.fromJson(delivered));
        assertTrue(bus.getEventsUnsent().isEmpty());
        assertTrue(bus.getEventsSent().contains(msg));
        assertTrue(bus.getPendingConfirmation().isEmpty());
    }

    @Test
    void unmatchedEventIsStillConfirmedWhenReceiverIsPresent() {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        MessageForwarderToLocalBroker forwarder = new MessageForwarderToLocalBroker(OpenTelemetry.noop())
                .addReceiver(new MessageEventSubscriptionReceiver("console", () -> received::add),
                        MessageEventSubscriptionSet.ofGroups("workflows", "n8n.workflow"));
        bus.initialize(List.of(writer), List.of(forwarder));

        EventMessage msg = EventMessage.create("n8n.audit.userSignedUp");
        bus.publish(msg);

        assertTrue(bus.getEventsSent().contains(msg));
        assertTrue(received.isEmpty());
    }

    @Test
    void eventWithoutSubscribersStaysUnsent() {
        bus.initialize(List.of(writer), List.of(new MessageForwarderToLocalBroker(OpenTelemetry.noop())));

        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted");
        bus.publish(msg);

        assertTrue(bus.getEventsUnsent().contains(msg));
        assertTrue(bus.getPendingConfirmation().contains(msg.key()));
    }

    @Test
    void publishFreezesMessage() {
        bus.initialize(List.of(writer), List.of());
        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "1"));

        bus.publish(msg);

        assertTrue(msg.isFrozen());
        assertThrows(IllegalStateException.class, () -> msg.setPayload(Map.of("id", "2")));
    }

    @Test
    void publishBeforeInitializeFails() {
        assertThrows(IllegalStateException.class,
                () -> bus.publish(EventMessage.create("n8n.workflow.workflowStarted")));
    }

    @Test
    void replaysUnsentEventsOnNextInitialize() {
        RecordingForwarder rejecting = new RecordingForwarder(false);
        bus.initialize(List.of(writer), List.of(rejecting));
        EventMessage lost = EventMessage.create("n8n.workflow.workflowStarted");
        bus.publish(lost);

        // same writer, no close in between: the first bus crashed
        MessageEventBus restarted = new MessageEventBus(OpenTelemetry.noop());
        RecordingForwarder accepting = new RecordingForwarder(true);
        restarted.initialize(List.of(writer), List.of(accepting));

        assertEquals(1, accepting.forwarded.stream().filter(m -> m.id().equals(lost.id())).count());
        assertEquals(3, accepting.forwarded.size());
        assertEquals(MessageEventBus.EVENT_BUS_INITIALIZED, accepting.names().get(0));
        assertTrue(restarted.getEventsUnsent().isEmpty());
        assertEquals(3, restarted.getEventsSent().size());
        restarted.close();
    }

    @Test
    void replayIsInKeyOrder() {
        long base = System.currentTimeMillis() - 10_000;
        EventMessage second = EventMessage.create("b", Instant.ofEpochMilli(base + 2000),
                "n8n.workflow.second", null, null, null);
        EventMessage first = EventMessage.create("a", Instant.ofEpochMilli(base + 1000),
                "n8n.workflow.first", null, null, null);
        writer.putMessage(second);
        writer.putMessage(first);
        RecordingForwarder forwarder = new RecordingForwarder(false);

        bus.initialize(List.of(writer), List.of(forwarder));

        assertEquals(List.of(MessageEventBus.EVENT_BUS_INITIALIZED, "n8n.workflow.first", "n8n.workflow.second",
                MessageEventBus.EVENT_BUS_INITIALIZED), forwarder.names());
    }

    @Test
    void failingForwarderDoesNotConfirm() {
        MessageEventBusForwarder failing = message -> {
            throw new IllegalStateException("boom");
        };
        bus.initialize(List.of(writer), List.of(failing));

        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted");
        assertDoesNotThrow(() -> bus.publish(msg));

        assertTrue(bus.getEventsUnsent().contains(msg));
    }

    @Test
    void anyAcceptingForwarderConfirms() {
        MessageEventBusForwarder failing = message -> {
            throw new IllegalStateException("boom");
        };
        RecordingForwarder accepting = new RecordingForwarder(true);
        bus.initialize(List.of(writer), List.of(failing, accepting));

        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted");
        bus.publish(msg);

        assertTrue(bus.getEventsSent().contains(msg));
        assertTrue(accepting.forwarded.contains(msg));
    }

    @Test
    void unionsEventsAcrossWriters() {
        InMemoryMessageEventBusWriter second = new InMemoryMessageEventBusWriter();
        EventMessage onlyInSecond = EventMessage.create("n8n.workflow.elsewhere");
        second.putMessage(onlyInSecond);
        bus.initialize(List.of(writer, second), List.of());

        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted");
        bus.publish(msg);

        List<EventMessage> unsent = bus.getEventsUnsent();
        assertEquals(3, unsent.size());
        assertEquals(1, unsent.stream().filter(m -> m.id().equals(msg.id())).count());
        assertTrue(unsent.contains(onlyInSecond));
        List<String> keys = unsent.stream().map(EventMessage::key).collect(Collectors.toList());
        assertEquals(keys.stream().sorted().collect(Collectors.toList()), keys);
    }

    @Test
    void noWritersMeansNoEvents() {
        bus.initialize(List.of(), List.of(new RecordingForwarder(true)));

        bus.publish(EventMessage.create("n8n.workflow.workflowStarted"));

        assertTrue(bus.getEventsSent().isEmpty());
        assertTrue(bus.getEventsUnsent().isEmpty());
    }

    @Test
    void writeFailurePropagatesAndSkipsForwarding() {
        MessageEventBusWriter failingWriter = mock(MessageEventBusWriter.class);
        doThrow(new WriteException("disk full", null)).when(failingWriter)
                .putMessage(argThat(m -> m != null && m.eventName().equals("n8n.workflow.failing")));
        MessageEventBusForwarder forwarder = mock(MessageEventBusForwarder.class);
        bus.initialize(List.of(failingWriter), List.of(forwarder));

        EventMessage msg = EventMessage.create("n8n.workflow.failing");

        assertThrows(WriteException.class, () -> bus.publish(msg));
        verify(forwarder, never()).forward(msg);
        verify(forwarder, times(1)).forward(any());
        assertFalse(bus.getPendingConfirmation().contains(msg.key()));
    }

    @Test
    void confirmGoesToEveryWriter() {
        MessageEventBusWriter first = mock(MessageEventBusWriter.class);
        MessageEventBusWriter second = mock(MessageEventBusWriter.class);
        bus.initialize(List.of(first, second), List.of(new RecordingForwarder(true)));

        EventMessage msg = EventMessage.create("n8n.workflow.workflowStarted");
        bus.publish(msg);

        verify(first).putMessage(msg);
        verify(second).putMessage(msg);
        verify(first).confirmMessageSent(msg.key());
        verify(second).confirmMessageSent(msg.key());
    }

    @Test
    void closeReleasesWritersAndForwarders() {
        RecordingForwarder forwarder = new RecordingForwarder(false);
        bus.initialize(List.of(writer), List.of(forwarder));
        bus.publish(EventMessage.create("n8n.workflow.workflowStarted"));

        bus.close();

        assertTrue(forwarder.closed);
        assertThrows(IllegalStateException.class, () -> writer.getMessages());
        assertFalse(bus.isInitialized());
        assertThrows(IllegalStateException.class, () -> bus.getEventsSent());
    }

    @Test
    void canBeInitializedAgainAfterClose() {
        bus.initialize(List.of(writer), List.of());
        bus.close();

        InMemoryMessageEventBusWriter fresh = new InMemoryMessageEventBusWriter();
        bus.initialize(List.of(fresh), List.of(new RecordingForwarder(true)));

        assertEquals(1, bus.getEventsSent().size());
    }

    @Test
    void initializeAgainReleasesReplacedWritersAndForwarders() {
        RecordingForwarder replaced = new RecordingForwarder(true);
        RecordingForwarder kept = new RecordingForwarder(true);
        InMemoryMessageEventBusWriter replacedWriter = new InMemoryMessageEventBusWriter();
        bus.initialize(List.of(writer, replacedWriter), List.of(replaced, kept));

        bus.initialize(List.of(writer), List.of(kept));

        assertTrue(replaced.closed);
        assertFalse(kept.closed);
        assertThrows(IllegalStateException.class, () -> replacedWriter.getMessages());
        assertEquals(2, writer.getMessagesSent().size());
    }
}

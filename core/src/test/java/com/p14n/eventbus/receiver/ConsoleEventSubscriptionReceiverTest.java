package com.p14n.eventbus.receiver;

import com.p14n.eventbus.data.EventMessage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleEventSubscriptionReceiverTest {

    @Test
    void printsEventNameAndPayload() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ConsoleEventSubscriptionReceiver receiver = new ConsoleEventSubscriptionReceiver("console",
                new PrintStream(bytes, true, StandardCharsets.UTF_8));
        ReceiverWorker worker = receiver.launchThread();

        worker.receive(EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "42")).toJson()).join();
        worker.receive("not an event").join();
        receiver.terminateThread();

        String output = bytes.toString(StandardCharsets.UTF_8);
        assertEquals("consoleEventSubscriber: Received Event n8n.workflow.workflowStarted || Payload: {\"id\":\"42\"}",
                output.trim());
    }

    @Test
    void defaultsToStandardOutName() {
        assertEquals(ConsoleEventSubscriptionReceiver.DEFAULT_NAME, new ConsoleEventSubscriptionReceiver().getName());
    }
}

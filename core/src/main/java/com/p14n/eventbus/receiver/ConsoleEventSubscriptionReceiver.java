package com.p14n.eventbus.receiver;

import com.p14n.eventbus.data.EventMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Receiver printing every delivered event to a stream, standard output by
 * default.
 */
public class ConsoleEventSubscriptionReceiver extends MessageEventSubscriptionReceiver {

    public static final String DEFAULT_NAME = "ConsoleEventSubscriptionReceiver";

    public ConsoleEventSubscriptionReceiver() {
        this(DEFAULT_NAME, System.out);
    }

    public ConsoleEventSubscriptionReceiver(String name, PrintStream out) {
        super(name, () -> new ConsoleWorker(out));
    }

    static final class ConsoleWorker implements EventSubscriberWorker {
        private static final Logger logger = LoggerFactory.getLogger(ConsoleWorker.class);

        private final PrintStream out;

        ConsoleWorker(PrintStream out) {
            this.out = out;
        }

        @Override
        public void receive(String serializedMessage) {
            EventMessage message;
            try {
                message = EventMessage.fromJson(serializedMessage);
            } catch (IllegalArgumentException e) {
                logger.atWarn().setCause(e).log("Ignoring message that is not an event message");
                return;
            }
            out.println("consoleEventSubscriber: Received Event " + message.eventName()
                    + " || Payload: " + message.payload());
        }
    }
}

package com.p14n.eventbus.broker;

import com.p14n.eventbus.bus.MessageEventBusForwarder;
import com.p14n.eventbus.data.EventMessage;
import com.p14n.eventbus.data.MessageEventSubscriptionSet;
import com.p14n.eventbus.receiver.MessageEventSubscriptionReceiver;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Forwarder delivering through an in-process {@link LocalEventBroker}.
 *
 * <p>
 * A message counts as accepted as soon as one running receiver was present,
 * whether or not any of its subscription sets matched the message.
 * </p>
 */
public class MessageForwarderToLocalBroker implements MessageEventBusForwarder {
    private static final Logger logger = LoggerFactory.getLogger(MessageForwarderToLocalBroker.class);

    private final LocalEventBroker broker;

    public MessageForwarderToLocalBroker(OpenTelemetry ot) {
        this(new LocalEventBroker(ot));
    }

    public MessageForwarderToLocalBroker(LocalEventBroker broker) {
        this.broker = broker;
        logger.atDebug().log("Local broker forwarder initialized");
    }

    @Override
    public boolean forward(EventMessage message) {
        DeliveryResult result = broker.addMessage(message);
        logger.atDebug().log("Forwarded {} {}, receivers: {}, sent: {}", message.eventName(), message.id(),
                result.subscribersProcessed(), result.subscribersSent());
        return result.subscribersProcessed() > 0;
    }

    public MessageForwarderToLocalBroker addReceiver(MessageEventSubscriptionReceiver receiver,
            MessageEventSubscriptionSet... subscriptionSets) {
        broker.addReceiver(receiver, subscriptionSets);
        return this;
    }

    public MessageForwarderToLocalBroker addSubscription(MessageEventSubscriptionReceiver receiver,
            Collection<MessageEventSubscriptionSet> subscriptionSets) {
        broker.addSubscriptionSets(receiver.getName(), subscriptionSets);
        return this;
    }

    public MessageForwarderToLocalBroker removeReceiver(String receiverName) {
        broker.removeReceiver(receiverName);
        return this;
    }

    public LocalEventBroker getBroker() {
        return broker;
    }

    /**
     * Terminates every receiver of the broker.
     */
    @Override
    public void close() {
        broker.close();
    }
}

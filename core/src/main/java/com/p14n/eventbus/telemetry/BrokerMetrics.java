package com.p14n.eventbus.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for event bus and broker operations.
 *
 * <p>
 * This class provides the following metrics:
 * </p>
 * <ul>
 * <li>events_published: Counter for events persisted by the bus, per event
 * group</li>
 * <li>events_confirmed: Counter for events moved to the sent partition</li>
 * <li>events_delivered: Counter for deliveries handed to receiver workers, per
 * receiver</li>
 * <li>dispatch_failures: Counter for deliveries that could not be handed to a
 * worker, per receiver</li>
 * <li>active_receivers: Up/down counter for receivers registered with the
 * broker</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> GROUP = AttributeKey.stringKey("event.group");
        private static final AttributeKey<String> RECEIVER = AttributeKey.stringKey("receiver");

        private final LongCounter publishedEvents;
        private final LongCounter confirmedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter dispatchFailures;
        private final LongUpDownCounter activeReceivers;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events persisted by the bus")
                                .build();

                confirmedEvents = meter.counterBuilder("events_confirmed")
                                .setDescription("Number of events confirmed as delivered")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events handed to receiver workers")
                                .build();

                dispatchFailures = meter.counterBuilder("dispatch_failures")
                                .setDescription("Number of events that could not be handed to a receiver worker")
                                .build();

                activeReceivers = meter.upDownCounterBuilder("active_receivers")
                                .setDescription("Number of registered receivers")
                                .build();
        }

        public void recordPublished(String group) {
                publishedEvents.add(1, Attributes.of(GROUP, group));
        }

        public void recordConfirmed() {
                confirmedEvents.add(1);
        }

        public void recordDelivered(String receiver) {
                deliveredEvents.add(1, Attributes.of(RECEIVER, receiver));
        }

        public void recordDispatchFailed(String receiver) {
                dispatchFailures.add(1, Attributes.of(RECEIVER, receiver));
        }

        public void recordReceiverAdded(String receiver) {
                activeReceivers.add(1, Attributes.of(RECEIVER, receiver));
        }

        public void recordReceiverRemoved(String receiver) {
                activeReceivers.add(-1, Attributes.of(RECEIVER, receiver));
        }
}

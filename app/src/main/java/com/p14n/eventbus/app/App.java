package com.p14n.eventbus.app;

import com.p14n.eventbus.broker.MessageForwarderToLocalBroker;
import com.p14n.eventbus.bus.MessageEventBus;
import com.p14n.eventbus.data.EventBusConfig;
import com.p14n.eventbus.data.MessageEventSubscriptionSet;
import com.p14n.eventbus.db.PoolSetup;
import com.p14n.eventbus.receiver.ConsoleEventSubscriptionReceiver;
import com.p14n.eventbus.receiver.FileEventSubscriptionReceiver;
import com.p14n.eventbus.store.PostgresMessageEventBusWriter;
import com.zaxxer.hikari.HikariDataSource;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.instrumentation.jdbc.datasource.JdbcTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

import javax.sql.DataSource;

public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        AppConfig config = AppConfig.fromEnv(System.getenv());

        OpenTelemetrySdk ot = Opentelemetry.create("eventbus", config.otlpEndpoint());
        HikariDataSource pool = PoolSetup.createPool(config.eventBus());
        DataSource ds = JdbcTelemetry.create(ot).wrap(pool);

        MessageEventBus bus = start(config, ds, ot, Path.of(System.getProperty("user.dir")));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down");
            close(bus);
            close(pool);
            close(ot);
        }, "eventbus-shutdown"));

        Thread.currentThread().join();
    }

    /**
     * Wires the writer, the local broker forwarder and its receivers, and
     * initializes the bus, which replays anything left unsent by the last run.
     */
    static MessageEventBus start(AppConfig config, DataSource ds, OpenTelemetry ot, Path baseDirectory) {
        EventBusConfig cfg = config.eventBus();
        PostgresMessageEventBusWriter writer = new PostgresMessageEventBusWriter(ds, cfg).start();
        MessageForwarderToLocalBroker forwarder = buildForwarder(config, ot, baseDirectory);

        MessageEventBus bus = new MessageEventBus(ot);
        bus.initialize(List.of(writer), List.of(forwarder));
        logger.atInfo().log("Event bus running on {} schema {}", cfg.jdbcUrl(), cfg.schema());
        return bus;
    }

    static MessageForwarderToLocalBroker buildForwarder(AppConfig config, OpenTelemetry ot, Path baseDirectory) {
        MessageForwarderToLocalBroker forwarder = new MessageForwarderToLocalBroker(ot);
        forwarder.addReceiver(new ConsoleEventSubscriptionReceiver(),
                MessageEventSubscriptionSet.ofGroups("console", config.consoleGroups().toArray(new String[0])));
        if (config.eventLogFile() != null) {
            forwarder.addReceiver(new FileEventSubscriptionReceiver(FileEventSubscriptionReceiver.DEFAULT_NAME,
                    config.eventLogFile(), baseDirectory),
                    MessageEventSubscriptionSet.ofGroups("file", config.fileGroups().toArray(new String[0])));
        }
        return forwarder;
    }

    private static void close(AutoCloseable c) {
        try {
            if (c != null) {
                c.close();
            }
        } catch (Exception e) {
            logger.atWarn().setCause(e).log("Error closing {}", c.getClass().getSimpleName());
        }
    }
}

package com.p14n.eventbus.data;

import java.util.Properties;

/**
 * Configuration interface for the event bus.
 * Defines the database connectivity of the durable log store and the
 * retention settings applied to delivered messages.
 */
public interface EventBusConfig {

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    /**
     * Gets the database username.
     *
     * @return The database username
     */
    String dbUser();

    /**
     * Gets the database password.
     *
     * @return The database password
     */
    String dbPassword();

    /**
     * Gets the database name.
     *
     * @return The database name
     */
    String dbName();

    /**
     * Gets the schema holding the {@code unsent} and {@code sent} partitions.
     * Each log store instance uses its own schema.
     *
     * @return The schema name
     */
    String schema();

    /**
     * Gets the interval between retention sweeps of the {@code sent} partition.
     *
     * @return The interval in seconds
     */
    int compactionIntervalSeconds();

    /**
     * Gets how long delivered messages are kept before a sweep removes them.
     *
     * @return The age limit in seconds
     */
    long sentRetentionSeconds();

    /**
     * Gets additional pool properties for overriding defaults.
     *
     * @return Properties object containing override values, may be null
     */
    Properties overrideProps();

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}

package com.p14n.eventbus.data;

import java.util.Properties;

public record ConfigData(String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        String schema,
        int compactionIntervalSeconds,
        long sentRetentionSeconds,
        Properties overrideProps) implements EventBusConfig {

    public static final String DEFAULT_SCHEMA = "eventbus";
    public static final int DEFAULT_COMPACTION_INTERVAL_SECONDS = 5;
    public static final long DEFAULT_SENT_RETENTION_SECONDS = 10;

    public ConfigData(String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName,
                      String schema) {
        this(dbHost, dbPort, dbUser, dbPassword, dbName, schema,
                DEFAULT_COMPACTION_INTERVAL_SECONDS, DEFAULT_SENT_RETENTION_SECONDS, null);
    }

    public ConfigData(String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(dbHost, dbPort, dbUser, dbPassword, dbName, DEFAULT_SCHEMA);
    }
}

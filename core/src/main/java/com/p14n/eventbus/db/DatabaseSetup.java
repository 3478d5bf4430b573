package com.p14n.eventbus.db;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the schema and partition tables of a log store. Every step is
 * idempotent.
 */
public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    private final DataSource dataSource;

    public DatabaseSetup(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static String validSchemaName(String schema) {
        if (schema == null || schema.trim().isEmpty()) {
            throw new IllegalArgumentException("Schema name cannot be null or empty");
        }
        if (!schema.matches("^[a-z_][a-z0-9_]*$")) {
            throw new IllegalArgumentException("Schema name must be a lowercase SQL identifier");
        }
        return schema;
    }

    public DatabaseSetup setupAll(String schema) {
        createSchemaIfNotExists(schema);
        createPartitionIfNotExists(schema, SQL.UNSENT);
        createPartitionIfNotExists(schema, SQL.SENT);
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists(String schema) {
        validSchemaName(schema);
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            logger.atInfo().log("Schema creation completed successfully for {}", schema);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema {}", schema);
            throw new RuntimeException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createPartitionIfNotExists(String schema, String partition) {
        validSchemaName(schema);
        if (!SQL.UNSENT.equals(partition) && !SQL.SENT.equals(partition)) {
            throw new IllegalArgumentException("Unknown partition: " + partition);
        }

        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = String.format("""
                    CREATE TABLE IF NOT EXISTS %s.%s (
                        key VARCHAR(255) PRIMARY KEY,
                        ts BIGINT NOT NULL,
                        value TEXT NOT NULL
                    )""", schema, partition);
            stmt.execute(sql);
            stmt.execute(String.format("CREATE INDEX IF NOT EXISTS %s_ts_idx ON %s.%s (ts)",
                    partition, schema, partition));
            logger.atInfo().log("Partition creation completed successfully for {}.{}", schema, partition);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating partition {}.{}", schema, partition);
            throw new RuntimeException("Failed to create partition table", e);
        }
        return this;
    }
}

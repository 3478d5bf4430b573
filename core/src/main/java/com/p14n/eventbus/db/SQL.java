package com.p14n.eventbus.db;

import com.p14n.eventbus.data.EventMessage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility class providing SQL statements and helper methods for the log store
 * partitions.
 *
 * <p>
 * Both partitions share one layout:
 * </p>
 * <ul>
 * <li>{@code key}: the message storage key, primary key</li>
 * <li>{@code ts}: epoch millis encoded in the key, used by retention</li>
 * <li>{@code value}: the serialized message</li>
 * </ul>
 *
 * <p>
 * Keys are compared with the {@code "C"} collation so that database ordering
 * is the same byte ordering the keys were designed for.
 * </p>
 */
public class SQL {

    /** Private constructor to prevent instantiation of utility class */
    private SQL() {
    }

    /** Partition holding messages not yet confirmed as delivered */
    public static final String UNSENT = "unsent";

    /** Partition holding confirmed messages until retention removes them */
    public static final String SENT = "sent";

    /** Column names of a partition */
    public static final String COLS = "key, ts, value";

    /** Placeholder parameters for partition columns */
    public static final String PH = "?,?,?";

    public static String insert(String schema, String partition) {
        return String.format("INSERT INTO %s.%s (%s) VALUES (%s)", schema, partition, COLS, PH);
    }

    /**
     * Inserts into {@code unsent} unless the key was already confirmed. A
     * repeated put of an unsent key replaces the stored value. The key is bound
     * a second time as parameter 4.
     */
    public static String insertUnsent(String schema) {
        return String.format("INSERT INTO %s.%s (%s) SELECT %s WHERE NOT EXISTS "
                + "(SELECT 1 FROM %s.%s WHERE key = ?) "
                + "ON CONFLICT (key) DO UPDATE SET ts = EXCLUDED.ts, value = EXCLUDED.value",
                schema, UNSENT, COLS, PH, schema, SENT);
    }

    public static String selectOrdered(String schema, String partition) {
        return String.format("SELECT %s FROM %s.%s ORDER BY key COLLATE \"C\"", COLS, schema, partition);
    }

    public static String selectAllOrdered(String schema) {
        return String.format("SELECT %s FROM (SELECT %s FROM %s.%s UNION ALL SELECT %s FROM %s.%s) AS combined "
                + "ORDER BY key COLLATE \"C\"", COLS, COLS, schema, SENT, COLS, schema, UNSENT);
    }

    public static String selectKeysOrdered(String schema, String partition) {
        return String.format("SELECT key FROM %s.%s ORDER BY key COLLATE \"C\"", schema, partition);
    }

    public static String deleteReturning(String schema, String partition) {
        return String.format("DELETE FROM %s.%s WHERE key = ? RETURNING %s", schema, partition, COLS);
    }

    public static String insertIgnoringDuplicates(String schema, String partition) {
        return insert(schema, partition) + " ON CONFLICT (key) DO NOTHING";
    }

    public static String deleteOlderThan(String schema, String partition) {
        return String.format("DELETE FROM %s.%s WHERE ts < ?", schema, partition);
    }

    /**
     * Sets the partition columns of a message on a PreparedStatement.
     *
     * @param stmt    PreparedStatement to set parameters on
     * @param message Message containing the data to set
     * @throws SQLException if any database access error occurs
     */
    public static void setMessageOnStatement(PreparedStatement stmt, EventMessage message) throws SQLException {
        stmt.setString(1, message.key());
        stmt.setLong(2, message.timestamp().toEpochMilli());
        stmt.setString(3, message.toJson());
    }

    /**
     * Reads every row of a result set into messages, preserving row order.
     *
     * @param rs ResultSet with a {@code value} column
     * @return the deserialized messages
     * @throws SQLException if any database access error occurs
     */
    public static List<EventMessage> messagesFromResultSet(ResultSet rs) throws SQLException {
        List<EventMessage> messages = new ArrayList<>();
        while (rs.next()) {
            messages.add(EventMessage.fromJson(rs.getString("value")));
        }
        return messages;
    }

    /**
     * Safely closes a database connection.
     * Handles null connections and suppresses any exceptions during closure.
     *
     * @param conn Connection to close (may be null)
     */
    public static void closeConnection(Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.close();
                }
            } catch (SQLException closeEx) {
                // nothing left to release
            }
        }
    }

    /**
     * Handles SQLException by attempting to rollback the transaction.
     * If rollback fails, the rollback exception is added as a suppressed exception.
     *
     * @param e    Original SQLException that triggered the rollback
     * @param conn Connection to rollback (may be null)
     */
    public static void handleSQLException(SQLException e, Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.rollback();
                }
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
        }
    }
}

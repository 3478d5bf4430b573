package com.p14n.eventbus.store;

import com.p14n.eventbus.broker.AsyncExecutor;
import com.p14n.eventbus.broker.DefaultExecutor;
import com.p14n.eventbus.data.EventBusConfig;
import com.p14n.eventbus.data.EventMessage;
import com.p14n.eventbus.db.DatabaseSetup;
import com.p14n.eventbus.db.SQL;
import com.p14n.eventbus.errors.CompactionException;
import com.p14n.eventbus.errors.EventBusException;
import com.p14n.eventbus.errors.WriteException;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Durable {@link MessageEventBusWriter} storing the {@code unsent} and
 * {@code sent} partitions as two tables in a PostgreSQL schema.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>One schema per writer instance, created on {@link #start()}</li>
 * <li>Confirmation deletes from {@code unsent} and inserts into {@code sent}
 * in a single transaction</li>
 * <li>A background sweep on a fixed interval drops delivered messages older
 * than the retention limit</li>
 * <li>{@link #close()} waits for an in-flight sweep; nothing touches the
 * database afterwards</li>
 * </ul>
 *
 * <p>
 * The writer takes ownership of the {@link DataSource}: when it is
 * {@link AutoCloseable} (a Hikari pool, for example) it is closed with the
 * writer.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var writer = new PostgresMessageEventBusWriter(PoolSetup.createPool(cfg), cfg).start();
 * writer.putMessage(message);
 * writer.confirmMessageSent(message.key());
 * writer.close();
 * }</pre>
 */
public class PostgresMessageEventBusWriter implements MessageEventBusWriter {
    private static final Logger logger = LoggerFactory.getLogger(PostgresMessageEventBusWriter.class);

    @FunctionalInterface
    private interface SqlOperation<T> {
        T run() throws SQLException;
    }

    private final DataSource dataSource;
    private final String schema;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;
    private final int compactionIntervalSeconds;
    private final long sentRetentionSeconds;
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile boolean started;
    private volatile boolean closed;
    private volatile ScheduledFuture<?> compaction;

    /**
     * Creates a writer with its own single-thread scheduler for retention
     * sweeps.
     *
     * @param dataSource The database to store the partitions in
     * @param cfg        Schema and retention settings
     */
    public PostgresMessageEventBusWriter(DataSource dataSource, EventBusConfig cfg) {
        this(dataSource, cfg.schema(), new DefaultExecutor(1), true,
                cfg.compactionIntervalSeconds(), cfg.sentRetentionSeconds());
    }

    /**
     * Creates a writer scheduling retention sweeps on a shared executor, which
     * the writer does not shut down.
     *
     * @param dataSource                The database to store the partitions in
     * @param schema                    Schema holding this writer's partitions
     * @param asyncExecutor             Executor running the retention sweep
     * @param compactionIntervalSeconds Seconds between sweeps
     * @param sentRetentionSeconds      Age limit of delivered messages
     */
    public PostgresMessageEventBusWriter(DataSource dataSource, String schema, AsyncExecutor asyncExecutor,
            int compactionIntervalSeconds, long sentRetentionSeconds) {
        this(dataSource, schema, asyncExecutor, false, compactionIntervalSeconds, sentRetentionSeconds);
    }

    private PostgresMessageEventBusWriter(DataSource dataSource, String schema, AsyncExecutor asyncExecutor,
            boolean ownsExecutor, int compactionIntervalSeconds, long sentRetentionSeconds) {
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource cannot be null");
        }
        if (compactionIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Compaction interval must be positive");
        }
        if (sentRetentionSeconds < 0) {
            throw new IllegalArgumentException("Retention cannot be negative");
        }
        this.dataSource = dataSource;
        this.schema = DatabaseSetup.validSchemaName(schema);
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
        this.compactionIntervalSeconds = compactionIntervalSeconds;
        this.sentRetentionSeconds = sentRetentionSeconds;
    }

    /**
     * Creates the schema and partitions if needed and schedules the retention
     * sweep.
     *
     * @return this writer
     * @throws IllegalStateException if the writer has been closed
     */
    public PostgresMessageEventBusWriter start() {
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Writer is closed");
            }
            if (started) {
                return this;
            }
            new DatabaseSetup(dataSource).setupAll(schema);
            compaction = asyncExecutor.scheduleAtFixedRate(this::compact,
                    compactionIntervalSeconds, compactionIntervalSeconds, TimeUnit.SECONDS);
            started = true;
            logger.atInfo().log("Event log writer started on schema {}", schema);
            return this;
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    public String getSchema() {
        return schema;
    }

    @Override
    public void putMessage(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        withOpenStore(() -> {
            try (Connection conn = dataSource.getConnection();
                    PreparedStatement stmt = conn.prepareStatement(SQL.insertUnsent(schema))) {
                SQL.setMessageOnStatement(stmt, message);
                stmt.setString(4, message.key());
                stmt.executeUpdate();
            } catch (SQLException e) {
                logger.atError().setCause(e).log("Error persisting event message {}", message.key());
                throw new WriteException("Failed to persist event message " + message.key(), e);
            }
            return null;
        });
    }

    @Override
    public void confirmMessageSent(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        withOpenStore(() -> {
            Connection conn = null;
            try {
                conn = dataSource.getConnection();
                conn.setAutoCommit(false);
                boolean moved = false;
                try (PreparedStatement delete = conn.prepareStatement(SQL.deleteReturning(schema, SQL.UNSENT))) {
                    delete.setString(1, key);
                    try (ResultSet rs = delete.executeQuery()) {
                        if (rs.next()) {
                            try (PreparedStatement insert = conn
                                    .prepareStatement(SQL.insertIgnoringDuplicates(schema, SQL.SENT))) {
                                insert.setString(1, rs.getString("key"));
                                insert.setLong(2, rs.getLong("ts"));
                                insert.setString(3, rs.getString("value"));
                                insert.executeUpdate();
                            }
                            moved = true;
                        }
                    }
                }
                conn.commit();
                logger.atDebug().log("Key {} {}", key, moved ? "confirmed" : "not unsent, nothing to confirm");
            } catch (SQLException e) {
                logger.atError().setCause(e).log("Error confirming event message {}", key);
                SQL.handleSQLException(e, conn);
                throw new WriteException("Failed to confirm event message " + key, e);
            } finally {
                SQL.closeConnection(conn);
            }
            return null;
        });
    }

    @Override
    public List<EventMessage> getMessages() {
        return query(SQL.selectAllOrdered(schema));
    }

    @Override
    public List<EventMessage> getMessagesSent() {
        return query(SQL.selectOrdered(schema, SQL.SENT));
    }

    @Override
    public List<EventMessage> getMessagesUnsent() {
        return query(SQL.selectOrdered(schema, SQL.UNSENT));
    }

    @Override
    public Set<String> recoverUnsentMessages() {
        return withOpenStore(() -> {
            Set<String> keys = new LinkedHashSet<>();
            try (Connection conn = dataSource.getConnection();
                    PreparedStatement stmt = conn.prepareStatement(SQL.selectKeysOrdered(schema, SQL.UNSENT));
                    ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("key"));
                }
            } catch (SQLException e) {
                logger.atError().setCause(e).log("Error listing unsent keys in {}", schema);
                throw new EventBusException("Failed to list unsent event messages", e);
            }
            logger.atDebug().log("Found {} unsent keys in {}", keys.size(), schema);
            return keys;
        });
    }

    @Override
    public int flushSentMessages(long ageLimitSeconds) {
        long cutoff = System.currentTimeMillis() - TimeUnit.SECONDS.toMillis(ageLimitSeconds);
        return withOpenStore(() -> {
            try (Connection conn = dataSource.getConnection();
                    PreparedStatement stmt = conn.prepareStatement(SQL.deleteOlderThan(schema, SQL.SENT))) {
                stmt.setLong(1, cutoff);
                int removed = stmt.executeUpdate();
                logger.atDebug().log("Removed {} sent event messages older than {}s from {}", removed,
                        ageLimitSeconds, schema);
                return removed;
            } catch (SQLException e) {
                throw new CompactionException("Failed to remove old sent event messages from " + schema, e);
            }
        });
    }

    /**
     * Scheduled retention sweep. Failures are logged and the next tick retries.
     */
    void compact() {
        if (closed) {
            return;
        }
        try {
            flushSentMessages(sentRetentionSeconds);
        } catch (RuntimeException e) {
            if (closed) {
                // closed while waiting for the lifecycle lock
                return;
            }
            logger.atWarn().setCause(e).log("Retention sweep of {} failed, retrying on next tick", schema);
        }
    }

    @Override
    public void close() {
        ScheduledFuture<?> scheduled = compaction;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (ownsExecutor) {
                asyncExecutor.close();
            }
            if (dataSource instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) dataSource).close();
                } catch (Exception e) {
                    logger.atWarn().setCause(e).log("Error closing data source of {}", schema);
                }
            }
            logger.atInfo().log("Event log writer on schema {} closed", schema);
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    private List<EventMessage> query(String sql) {
        return withOpenStore(() -> {
            try (Connection conn = dataSource.getConnection();
                    PreparedStatement stmt = conn.prepareStatement(sql);
                    ResultSet rs = stmt.executeQuery()) {
                return SQL.messagesFromResultSet(rs);
            } catch (SQLException e) {
                logger.atError().setCause(e).log("Error reading event messages from {}", schema);
                throw new EventBusException("Failed to read event messages", e);
            }
        });
    }

    private <T> T withOpenStore(SqlOperation<T> operation) {
        lifecycle.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Writer is closed");
            }
            if (!started) {
                throw new IllegalStateException("Writer has not been started");
            }
            return operation.run();
        } catch (SQLException e) {
            throw new EventBusException("Unexpected database error", e);
        } finally {
            lifecycle.readLock().unlock();
        }
    }
}

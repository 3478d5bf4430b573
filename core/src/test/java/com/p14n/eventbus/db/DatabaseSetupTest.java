package com.p14n.eventbus.db;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseSetupTest {

    private EmbeddedPostgres pg;
    private DatabaseSetup setup;

    @BeforeEach
    public void setUp() throws Exception {
        pg = EmbeddedPostgres.start();
        setup = new DatabaseSetup(pg.getPostgresDatabase());
    }

    @AfterEach
    public void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    @Test
    public void setupIsIdempotent() throws SQLException {
        setup.setupAll("events");
        setup.setupAll("events");

        try (Connection conn = pg.getPostgresDatabase().getConnection();
                ResultSet rs = conn.getMetaData().getIndexInfo(null, "events", "sent", false, false)) {
            boolean tsIndex = false;
            while (rs.next()) {
                if ("sent_ts_idx".equals(rs.getString("INDEX_NAME"))) {
                    tsIndex = true;
                }
            }
            assertTrue(tsIndex);
        }
    }

    @Test
    public void rejectsUnknownPartition() {
        assertThrows(IllegalArgumentException.class, () -> setup.createPartitionIfNotExists("events", "pending"));
    }

    @Test
    public void validatesSchemaNames() {
        assertEquals("event_log_2", DatabaseSetup.validSchemaName("event_log_2"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseSetup.validSchemaName(null));
        assertThrows(IllegalArgumentException.class, () -> DatabaseSetup.validSchemaName("2events"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseSetup.validSchemaName("events;drop"));
    }
}

package com.p14n.eventbus.db;

import com.p14n.eventbus.data.EventBusConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public class PoolSetup {

    private PoolSetup() {
    }

    /**
     * Creates and configures a connection pool using HikariCP.
     * Override properties from the configuration are applied first, so the
     * connection details always come from the configuration itself.
     *
     * @param cfg Configuration containing database connection details
     * @return Configured DataSource, closed when the owning writer closes
     */
    public static HikariDataSource createPool(EventBusConfig cfg) {
        HikariConfig hc = cfg.overrideProps() == null ? new HikariConfig() : new HikariConfig(cfg.overrideProps());
        hc.setJdbcUrl(cfg.jdbcUrl());
        hc.setUsername(cfg.dbUser());
        hc.setPassword(cfg.dbPassword());
        if (hc.getPoolName() == null) {
            hc.setPoolName("eventbus-" + cfg.schema());
        }
        return new HikariDataSource(hc);
    }
}

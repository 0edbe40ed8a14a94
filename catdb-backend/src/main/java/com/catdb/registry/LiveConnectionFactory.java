package com.catdb.registry;

import com.catdb.config.CatdbSettings;
import com.catdb.driver.JdbcTarget;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

/**
 * Builds pooled {@link LiveConnection} handles. Building never opens a physical connection.
 */
@Component
public class LiveConnectionFactory {

    private static final long MIN_TIMEOUT_MS = 250;

    private final CatdbSettings settings;

    public LiveConnectionFactory(CatdbSettings settings) {
        this.settings = settings;
    }

    /**
     * Create a handle for a target.
     *
     * @param name display name
     * @param target JDBC target
     * @return handle
     */
    public LiveConnection open(String name, JdbcTarget target) {
        return new LiveConnection(name, target, new HikariDataSource(buildHikariConfig(name, target)));
    }

    HikariConfig buildHikariConfig(String name, JdbcTarget target) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(LiveConnectionExceptionOverride.class.getName());
        config.setJdbcUrl(target.getUrl());
        if (target.getDriverClass() != null) {
            config.setDriverClassName(target.getDriverClass());
        }
        if (target.getUsername() != null) {
            config.setUsername(target.getUsername());
        }
        if (target.getPassword() != null) {
            config.setPassword(target.getPassword());
        }
        target.getProperties().forEach(config::addDataSourceProperty);
        if (target.getInitSql() != null) {
            config.setConnectionInitSql(target.getInitSql());
        }

        long probeMs = Math.max(MIN_TIMEOUT_MS * 2, settings.probeTimeout().toMillis());
        config.setConnectionTimeout(probeMs);
        config.setValidationTimeout(Math.max(MIN_TIMEOUT_MS, probeMs / 2));
        config.setMaximumPoolSize(Math.max(1, settings.maxPoolSize()));
        config.setMinimumIdle(0);
        // construct lazily; the first borrow opens the first physical connection
        config.setInitializationFailTimeout(-1);
        config.setPoolName("catdb-" + name.replaceAll("[^A-Za-z0-9_.-]", "_"));
        return config;
    }
}

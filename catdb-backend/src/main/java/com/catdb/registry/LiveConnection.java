package com.catdb.registry;

import com.catdb.driver.JdbcTarget;
import com.catdb.model.ConnectionKind;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

/**
 * A pooled handle bound to one display name. Owned by {@link ConnectionRegistry}; callers borrow
 * it for one operation and take physical connections from it with {@link #getConnection()}.
 */
@Slf4j
public class LiveConnection implements AutoCloseable {

    private final String id = UUID.randomUUID().toString();
    private final String name;
    private final JdbcTarget target;
    private final HikariDataSource dataSource;
    private final Instant createdAt = Instant.now();

    /**
     * Create a handle.
     *
     * @param name display name
     * @param target resolved JDBC target
     * @param dataSource pool
     */
    public LiveConnection(String name, JdbcTarget target, HikariDataSource dataSource) {
        this.name = name;
        this.target = target;
        this.dataSource = dataSource;
    }

    /**
     * Identity of this handle; a reconstructed handle for the same name gets a new id.
     *
     * @return id
     */
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ConnectionKind getKind() {
        return target.getKind();
    }

    public JdbcTarget getTarget() {
        return target;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Borrow a physical connection from the pool. Close it to give it back.
     *
     * @return connection
     * @throws SQLException when the pool cannot deliver one
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Round trip to the server on a fresh borrow.
     *
     * @param timeoutSeconds validation timeout
     * @throws SQLException when the database is unreachable or the connection is not valid
     */
    public void probe(int timeoutSeconds) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(Math.max(1, timeoutSeconds))) {
                throw new SQLException("Connection validation failed for " + name);
            }
        }
    }

    /**
     * Drop a physical connection from the pool instead of returning it, closing it underneath
     * any statement still running on it. Best effort.
     *
     * @param connection connection borrowed from this handle
     */
    public void evict(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            dataSource.evictConnection(connection);
        } catch (RuntimeException e) {
            log.debug("Evicting connection failed (name={}, error={})", name, e.getMessage());
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        try {
            dataSource.close();
        } catch (RuntimeException e) {
            log.warn("Closing connection pool failed (name={}, error={})", name, e.getMessage());
        }
    }
}

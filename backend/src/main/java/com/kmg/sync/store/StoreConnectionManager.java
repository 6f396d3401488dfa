package com.kmg.sync.store;

import com.kmg.sync.config.SyncProperties;
import com.kmg.sync.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.*;

/**
 * Named, lazily opened connections to the backing stores of one run.
 *
 * <p>A connection is opened on first use and kept for reuse until {@link #close()}; a connection found dead on
 * acquisition is reopened. Instances are not thread-safe: every concurrently executing run builds its own manager
 * through {@link StoreConnectionManagerFactory}.</p>
 */
public class StoreConnectionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreConnectionManager.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final Map<String, SyncProperties.Store> configs;
    private final Map<String, Connection> connections = new LinkedHashMap<>();

    public StoreConnectionManager(Map<String, SyncProperties.Store> configs, Collection<String> requiredStores) {
        this.configs = new LinkedHashMap<>(configs);
        validate(requiredStores);
    }

    public Connection acquire(String storeName) {
        SyncProperties.Store config = configs.get(storeName);
        if (config == null) {
            throw new ConfigurationException("No configuration found for store: " + storeName);
        }
        requireUrl(storeName, config);

        Connection existing = connections.get(storeName);
        if (existing != null && isAlive(existing)) {
            return existing;
        }
        if (existing != null) {
            log.warn("Connection to {} is no longer valid, reopening", storeName);
            closeQuietly(storeName, existing);
        }

        try {
            Connection connection = DriverManager.getConnection(config.getUrl(), config.getUsername(), config.getPassword());
            connection.setAutoCommit(false);
            connections.put(storeName, connection);
            log.debug("Opened connection to {}", storeName);
            return connection;
        } catch (SQLException e) {
            log.error("Failed to connect to {}: {}", storeName, e.getMessage());
            throw new CannotGetJdbcConnectionException("Failed to connect to " + storeName, e);
        }
    }

    /**
     * Runs {@code action} against the store and commits when it returns; any exception rolls the work back and is
     * rethrown.
     */
    public <T> T withCursor(String storeName, StoreCallback<T> action) {
        Connection connection = acquire(storeName);
        JdbcTemplate jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        T result;
        try {
            result = action.doInStore(jdbc);
        } catch (RuntimeException | Error e) {
            rollback(storeName, connection, e);
            log.error("Database operation failed for {}: {}", storeName, e.getMessage());
            throw e;
        }
        commit(storeName, connection);
        return result;
    }

    /**
     * Like {@link #withCursor} but brackets the body in an explicit begin/commit/rollback through a transaction
     * manager bound to the store connection.
     */
    public <T> T withTransaction(String storeName, StoreCallback<T> action) {
        Connection connection = acquire(storeName);
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(connection, true);
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        TransactionTemplate transaction = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        try {
            return transaction.execute(status -> action.doInStore(jdbc));
        } catch (RuntimeException | Error e) {
            log.error("Transaction failed for {}: {}", storeName, e.getMessage());
            throw e;
        }
    }

    public List<Map<String, Object>> query(String storeName, String sql, Object... args) {
        return withCursor(storeName, jdbc -> jdbc.queryForList(sql, args));
    }

    public Set<String> openStores() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(connections.keySet()));
    }

    @Override
    public void close() {
        for (Map.Entry<String, Connection> entry : connections.entrySet()) {
            closeQuietly(entry.getKey(), entry.getValue());
        }
        connections.clear();
    }

    private void validate(Collection<String> requiredStores) {
        for (String storeName : requiredStores) {
            SyncProperties.Store config = configs.get(storeName);
            if (config == null) {
                throw new ConfigurationException("Missing configuration for store: " + storeName);
            }
            requireUrl(storeName, config);
        }
    }

    private static void requireUrl(String storeName, SyncProperties.Store config) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new ConfigurationException("Missing required configuration fields for " + storeName + ": url");
        }
    }

    private boolean isAlive(Connection connection) {
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void commit(String storeName, Connection connection) {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new TransactionSystemException("Commit failed for " + storeName, e);
        }
    }

    private void rollback(String storeName, Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed for {}: {}", storeName, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private void closeQuietly(String storeName, Connection connection) {
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            log.warn("Failed to close connection to {}: {}", storeName, e.getMessage());
        }
    }
}

package de.bsommerfeld.convotree.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.convotree.core.config.ConvoTreeConfig;
import de.bsommerfeld.convotree.core.config.ConvoTreeConfigLoader;
import de.bsommerfeld.convotree.core.error.ConversationTreeException;
import de.bsommerfeld.convotree.core.util.StorageUtils;
import org.slf4j.Logger;
import org.sqlite.Function;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite-backed {@link TreeStore}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS}, so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per unit of work and closed right after.
 * SQLite serializes writes at the file level, so pooling buys nothing. Lock
 * waits are bounded by the configured {@code busy_timeout}. Each connection
 * registers {@link CaseFoldFunction} for Unicode-aware search.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #write} turns auto-commit off, commits when the work returns and
 * rolls back on any exception. Business exceptions are rethrown unchanged;
 * {@link SQLException}s are wrapped in {@link StoreException}.
 *
 * @see SqlStoreSession
 */
@Singleton
public class SqlTreeStore implements TreeStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlTreeStore.class);

    private final String dbUrl;
    private final Properties connectionProperties = new Properties();

    @Inject
    public SqlTreeStore(ConvoTreeConfig config) {
        this(StorageUtils.resolveDatabaseFile(config.database().path().orElse(null), ConvoTreeConfigLoader.APP_NAME),
                config.database().busyTimeoutMs());
    }

    public SqlTreeStore(Path databaseFile, int busyTimeoutMs) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory " + parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        this.connectionProperties.setProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        initialize();
    }

    Connection getConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(dbUrl, connectionProperties);
        try {
            Function.create(conn, CaseFoldFunction.NAME, new CaseFoldFunction());
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StoreException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}, one statement at a time, in
     * a single transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new SQLException("schema.sql not found on classpath");
            }
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = SqlLoader.stripCommentLines(sql);
                if (!statement.isEmpty())
                    stmt.execute(statement);
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    @Override
    public <T> T read(StoreWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.execute(new SqlStoreSession(conn));
        } catch (SQLException e) {
            LOG.error("Read failed", e);
            throw new StoreException("Read failed", e);
        }
    }

    @Override
    public <T> T write(StoreWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(new SqlStoreSession(conn));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Transaction failed", e);
            throw new StoreException("Transaction failed", e);
        }
    }

    private void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
        if (cause instanceof ConversationTreeException) {
            LOG.debug("Rolled back: {}", cause.getMessage());
        } else {
            LOG.warn("Rolled back after failure: {}", cause.toString());
        }
    }
}

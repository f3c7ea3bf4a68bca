package de.bsommerfeld.marketscope.db;

import de.bsommerfeld.marketscope.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Owns the SQLite file backing the research store and hands out connections
 * to the store components.
 *
 * <p>
 * The schema is applied from {@code schema.sql} on construction; every DDL
 * statement is {@code IF NOT EXISTS}, so opening an existing file is safe.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. Foreign keys are enforced on every connection, writers wait on a
 * busy timeout instead of failing, and explicit transactions begin
 * {@code IMMEDIATE} so two writers never deadlock on a lock upgrade.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #inTransaction} wraps multi-statement work with
 * rollback-on-failure; {@link #withConnection} runs in auto-commit, which
 * single statements and {@code VACUUM} need.
 */
public class ResearchDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(ResearchDatabase.class);
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final Path databaseFile;
    private final String dbUrl;
    private final Properties connectionProperties;

    /**
     * Opens (creating if necessary) the database at {@code databaseFile}.
     *
     * @throws StorageUnavailableException if the directory cannot be created
     *                                     or the schema cannot be applied
     */
    public ResearchDatabase(Path databaseFile) {
        this.databaseFile = databaseFile.toAbsolutePath();
        Path parent = this.databaseFile.getParent();
        try {
            if (parent != null) {
                StorageUtils.ensureDirectory(parent);
            }
        } catch (IOException e) {
            LOG.error("[DB] Cannot create database directory {}", parent, e);
            throw new StorageUnavailableException("Cannot create database directory " + parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + this.databaseFile;
        this.connectionProperties = connectionConfig().toProperties();
        initialize();
    }

    private static SQLiteConfig connectionConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return config;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void initialize() {
        LOG.info("[DB] Opening research store at {}", databaseFile);
        inTransaction("apply schema", conn -> {
            applySchema(conn);
            return null;
        });
    }

    /**
     * Applies {@code schema.sql}, one statement at a time. Any failure aborts
     * the whole schema transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql = SqlLoader.stripComments(SqlLoader.readResource("schema.sql"));
        int applied = 0;
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.isBlank())
                    continue;
                stmt.execute(sql.trim());
                applied++;
            }
        }
        LOG.debug("[DB] Schema applied ({} statements).", applied);
    }

    /**
     * Runs {@code work} on a fresh auto-commit connection.
     *
     * @param operation human-readable name used in logs and error messages
     */
    <T> T withConnection(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e);
        }
    }

    /**
     * Runs {@code work} in a single transaction. A {@link SQLException} or
     * any runtime exception rolls everything back before propagating.
     */
    <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(operation, e);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    public Path databaseFile() {
        return databaseFile;
    }

    /**
     * Current size of the database file in bytes.
     *
     * @throws StorageUnavailableException if the file cannot be inspected
     */
    public long sizeBytes() {
        try {
            return Files.size(databaseFile);
        } catch (IOException e) {
            LOG.error("[DB] Cannot read size of {}", databaseFile, e);
            throw new StorageUnavailableException("Cannot read size of " + databaseFile, e);
        }
    }
}

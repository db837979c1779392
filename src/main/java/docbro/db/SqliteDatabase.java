package docbro.db;

import docbro.config.RegistryConfig;
import docbro.errors.RepositoryException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Handle on one SQLite file: its single connection and the transaction
 * manager guarding it. The registry and every project shard each get one.
 */
public class SqliteDatabase implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    private final Path file;
    private final Connection connection;
    private final TransactionManager transactionManager;

    private SqliteDatabase(Path file, Connection connection) {
        this.file = file;
        this.connection = connection;
        this.transactionManager = new SqliteTransactionManager(connection);
    }

    /**
     * Open (creating if needed) a database file with the configured pragmas.
     *
     * @throws RepositoryException if the file cannot be opened
     */
    public static SqliteDatabase open(Path file, RegistryConfig config) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RepositoryException("Cannot create directory for " + file, e);
        }

        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA busy_timeout = " + config.getBusyTimeoutMillis());
                stmt.execute("PRAGMA journal_mode = " + config.getJournalMode());
                stmt.execute("PRAGMA foreign_keys = ON");
            } catch (SQLException e) {
                connection.close();
                throw e;
            }
            LOG.debug("Opened database {}", file);
            return new SqliteDatabase(file, connection);
        } catch (SQLException e) {
            throw new RepositoryException("Cannot open database " + file + ": " + e.getMessage(), e);
        }
    }

    public Path getFile() {
        return file;
    }

    public TransactionManager getTransactionManager() {
        return transactionManager;
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isClosed() {
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            LOG.warn("Cannot query state of {}: {}", file, e.getMessage());
            return true;
        }
    }

    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                connection.close();
                LOG.debug("Closed database {}", file);
            }
        } catch (SQLException e) {
            throw new RepositoryException("Error closing database " + file, e);
        }
    }
}

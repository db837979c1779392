package docbro.db;

import docbro.errors.AlreadyExistsException;
import docbro.errors.ProjectRegistryException;
import docbro.errors.RepositoryException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite implementation of TransactionManager.
 * One connection per file; a reentrant lock serialises access so that the
 * connection is never shared by two threads at once.
 */
public class SqliteTransactionManager implements TransactionManager {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteTransactionManager.class);

    /** SQLITE_CONSTRAINT primary result code */
    private static final int SQLITE_CONSTRAINT = 19;

    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Create a new SqliteTransactionManager with the given connection.
     *
     * @param connection The SQLite database connection
     */
    public SqliteTransactionManager(Connection connection) {
        this.connection = connection;
    }

    @Override
    public <T> T executeInTransaction(SqlWork<T> work) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1 && !connection.getAutoCommit()) {
                // Nested call joins the enclosing transaction
                return work.apply(connection);
            }
            return runTransaction(work);
        } catch (SQLException e) {
            throw translate(e);
        } finally {
            lock.unlock();
        }
    }

    private <T> T runTransaction(SqlWork<T> work) throws SQLException {
        boolean wasAutoCommit = connection.getAutoCommit();
        try {
            connection.setAutoCommit(false);

            T result = work.apply(connection);

            connection.commit();
            return result;

        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
                LOG.warn("Transaction rolled back due to error: {}", e.getMessage());
            } catch (SQLException rollbackEx) {
                LOG.error("Failed to rollback transaction: {}", rollbackEx.getMessage());
                e.addSuppressed(rollbackEx);
            }
            throw e;

        } finally {
            try {
                connection.setAutoCommit(wasAutoCommit);
            } catch (SQLException e) {
                LOG.error("Failed to restore autocommit: {}", e.getMessage());
            }
        }
    }

    @Override
    public <T> T execute(SqlWork<T> work) {
        lock.lock();
        try {
            return work.apply(connection);
        } catch (SQLException e) {
            throw translate(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Connection getConnection() {
        return connection;
    }

    /**
     * Map a storage engine error onto the registry's error taxonomy.
     * Unique constraint violations become {@link AlreadyExistsException};
     * everything else is wrapped in {@link RepositoryException}.
     */
    public static ProjectRegistryException translate(SQLException e) {
        if (isUniqueViolation(e)) {
            return new AlreadyExistsException("Unique constraint violated: " + e.getMessage(), e);
        }
        return new RepositoryException("Storage operation failed: " + e.getMessage(), e);
    }

    static boolean isUniqueViolation(SQLException e) {
        String message = e.getMessage();
        boolean constraint = (e.getErrorCode() & 0xff) == SQLITE_CONSTRAINT
                || (message != null && message.contains("SQLITE_CONSTRAINT"));
        return constraint && message != null && message.contains("UNIQUE");
    }
}

package docbro.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Manages database transactions for atomic operations.
 * Provides transaction boundaries for multi-statement database operations
 * and serialises all use of the underlying connection.
 */
public interface TransactionManager {

    /**
     * Unit of work run against the managed connection.
     *
     * @param <T> The result type
     */
    @FunctionalInterface
    interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Execute operations within a transaction and return a result.
     * Commits on success, rolls back on exception. A call made while the
     * current thread already runs a transaction joins it.
     *
     * @param <T> The return type
     * @param work The operation to execute with the connection
     * @return The result of the operation
     * @throws docbro.errors.ProjectRegistryException if the operation fails
     */
    <T> T executeInTransaction(SqlWork<T> work);

    /**
     * Execute a read (or a single auto-committed statement) while holding the
     * connection, without opening a transaction.
     *
     * @param <T> The return type
     * @param work The operation to execute with the connection
     * @return The result of the operation
     * @throws docbro.errors.ProjectRegistryException if the operation fails
     */
    <T> T execute(SqlWork<T> work);

    /**
     * Get the underlying connection.
     * Note: callers outside the migration engine should go through
     * {@link #executeInTransaction(SqlWork)} or {@link #execute(SqlWork)}.
     *
     * @return The database connection
     */
    Connection getConnection();
}

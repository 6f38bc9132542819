package org.morm.db;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One connection per transaction, auto-commit off for its whole lifetime.
 */
@Slf4j
public class JdbcTransactionManager implements TransactionManager {
    private final ConnectionProvider connectionProvider;
    private final int queryTimeoutSeconds;

    public JdbcTransactionManager(ConnectionProvider connectionProvider) {
        this(connectionProvider, 0);
    }

    public JdbcTransactionManager(ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        this.connectionProvider = connectionProvider;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) throws Exception {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            T result;
            try {
                result = callback.doInTransaction(new JdbcSqlExecutor(conn, queryTimeoutSeconds));
                conn.commit();
            } catch (Exception | Error e) {
                rollbackQuietly(conn, e);
                throw e;
            }
            return result;
        }
    }

    private static void rollbackQuietly(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            log.warn("Rollback failed: {}", rollbackFailure.getMessage());
        }
    }
}

package org.morm.db;

public interface TransactionManager {
    /**
     * Runs {@code callback} in a new transaction. Commits when it returns, rolls back and
     * rethrows when it throws.
     */
    <T> T inTransaction(TransactionCallback<T> callback) throws Exception;
}

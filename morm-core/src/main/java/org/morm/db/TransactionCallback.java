package org.morm.db;

@FunctionalInterface
public interface TransactionCallback<T> {
    T doInTransaction(SqlExecutor executor) throws Exception;
}

package org.morm.migration.dialect;

import org.morm.model.FieldSpec;

import java.util.List;

/**
 * DDL fragments of the target database. Every identifier goes through {@link #quoteIdentifier}.
 */
public interface DdlDialect {
    String quoteIdentifier(String raw);

    // Table
    String openCreateTable(String table);
    String closeCreateTable();
    String getColumnDefinitionSql(String table, FieldSpec field, String uniqueConstraintName);
    String getPrimaryKeyDefinitionSql(String primaryKey);
    String getDropTableSql(String table);

    // Column
    String getAddColumnSql(String table, FieldSpec field);
    String getDropColumnSql(String table, String fieldName);
    String getAlterColumnSql(String table, String fieldName, String op);

    // Constraints & Indexes
    String getAddUniqueConstraintSql(String table, String constraintName, List<String> columns);
    String getDropConstraintSql(String table, String constraintName);
    String getCreateIndexSql(String table, String indexName, String fieldName, String kind, String opClass);
    String getDropIndexSql(String indexName);
}

package org.morm.migration.dialect.postgres;

import org.morm.migration.dialect.DdlDialect;
import org.morm.model.FieldSpec;

import java.util.List;
import java.util.stream.Collectors;

public class PostgresDialect implements DdlDialect {

    private static final String INDENT = "    ";

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE " + quoteIdentifier(table) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n)";
    }

    @Override
    public String getColumnDefinitionSql(String table, FieldSpec field, String uniqueConstraintName) {
        StringBuilder sb = new StringBuilder(INDENT)
                .append(quoteIdentifier(field.getName()))
                .append(' ')
                .append(field.getSqlType().trim());
        appendFragment(sb, field.getOnAdd());
        if (uniqueConstraintName != null) {
            sb.append(" CONSTRAINT ").append(quoteIdentifier(uniqueConstraintName)).append(" UNIQUE");
        }
        return sb.toString();
    }

    @Override
    public String getPrimaryKeyDefinitionSql(String primaryKey) {
        return INDENT + "PRIMARY KEY (" + quoteIdentifier(primaryKey) + ")";
    }

    @Override
    public String getDropTableSql(String table) {
        return "DROP TABLE IF EXISTS " + quoteIdentifier(table);
    }

    @Override
    public String getAddColumnSql(String table, FieldSpec field) {
        StringBuilder sb = new StringBuilder(alterTable(table))
                .append(" ADD COLUMN ")
                .append(quoteIdentifier(field.getName()))
                .append(' ')
                .append(field.getSqlType().trim());
        appendFragment(sb, field.getOnAdd());
        return sb.toString();
    }

    @Override
    public String getDropColumnSql(String table, String fieldName) {
        return alterTable(table) + " DROP COLUMN " + quoteIdentifier(fieldName);
    }

    @Override
    public String getAlterColumnSql(String table, String fieldName, String op) {
        return alterTable(table) + " ALTER COLUMN " + quoteIdentifier(fieldName) + " " + op.trim();
    }

    @Override
    public String getAddUniqueConstraintSql(String table, String constraintName, List<String> columns) {
        return alterTable(table) + " ADD CONSTRAINT " + quoteIdentifier(constraintName)
                + " UNIQUE (" + quoteAll(columns) + ")";
    }

    @Override
    public String getDropConstraintSql(String table, String constraintName) {
        return alterTable(table) + " DROP CONSTRAINT IF EXISTS " + quoteIdentifier(constraintName);
    }

    @Override
    public String getCreateIndexSql(String table, String indexName, String fieldName, String kind, String opClass) {
        String column = quoteIdentifier(fieldName) + (opClass != null ? " " + opClass : "");
        return "CREATE INDEX IF NOT EXISTS " + quoteIdentifier(indexName) + " ON " + quoteIdentifier(table)
                + " USING " + kind + " (" + column + ")";
    }

    @Override
    public String getDropIndexSql(String indexName) {
        return "DROP INDEX IF EXISTS " + quoteIdentifier(indexName);
    }

    private String alterTable(String table) {
        return "ALTER TABLE " + quoteIdentifier(table);
    }

    private String quoteAll(List<String> columns) {
        return columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    private static void appendFragment(StringBuilder sb, String fragment) {
        if (fragment != null && !fragment.isBlank()) {
            sb.append(' ').append(fragment.trim());
        }
    }
}

package org.morm.migration.runner;

import org.morm.db.SqlExecutor;
import org.morm.db.TransactionManager;
import org.morm.exception.MormException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table in the target database listing every unit whose transaction committed. The row is
 * inserted by the unit's own transaction, so it exists exactly when the unit's SQL does.
 */
public class AppliedHistory {

    public static final String TABLE = "morm_applied_units";

    static final String CREATE_SQL = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "model_name VARCHAR(255) NOT NULL, "
            + "unit_sequence BIGINT NOT NULL, "
            + "applied_at VARCHAR(32) NOT NULL, "
            + "PRIMARY KEY (model_name, unit_sequence))";
    static final String INSERT_SQL = "INSERT INTO " + TABLE
            + " (model_name, unit_sequence, applied_at) VALUES (?, ?, ?)";
    static final String SELECT_SQL = "SELECT unit_sequence, applied_at FROM " + TABLE
            + " WHERE model_name = ? ORDER BY unit_sequence";

    private final TransactionManager transactionManager;

    public AppliedHistory(TransactionManager transactionManager) {
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager must not be null");
    }

    /**
     * Creates the table when missing and reads the committed units of {@code model}.
     *
     * @return applied-at timestamps keyed by sequence, ascending
     */
    public Map<Long, String> committedUnits(String model) {
        try {
            return transactionManager.inTransaction(db -> {
                db.execute(CREATE_SQL);
                Map<Long, String> committed = new LinkedHashMap<>();
                for (Map<String, Object> row : db.fetch(SELECT_SQL, model)) {
                    List<Object> values = List.copyOf(row.values());
                    committed.put(((Number) values.get(0)).longValue(), String.valueOf(values.get(1)));
                }
                return committed;
            });
        } catch (Exception e) {
            throw new MormException("Failed to read table " + TABLE + " for model " + model, e);
        }
    }

    /**
     * Must run on the executor of the unit's transaction, before it commits.
     */
    public void record(SqlExecutor db, String model, long sequence, String appliedAt) throws SQLException {
        db.execute(INSERT_SQL, model, sequence, appliedAt);
    }
}

package org.morm.db;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Handle on one open transaction. Everything executed through it commits or rolls back together.
 */
public interface SqlExecutor {
    void execute(String sql, Object... params) throws SQLException;

    /**
     * @return rows keyed by column label, in result order
     */
    List<Map<String, Object>> fetch(String sql, Object... params) throws SQLException;

    /**
     * @return first column of the first row, {@code null} if there is no row
     */
    Object fetchval(String sql, Object... params) throws SQLException;
}

package io.github.flameyossnowy.network.sql;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the current row of a result set to an entity. Must not advance the cursor.
 */
@FunctionalInterface
public interface RowMapper<T> {
    T map(ResultSet resultSet) throws SQLException;
}

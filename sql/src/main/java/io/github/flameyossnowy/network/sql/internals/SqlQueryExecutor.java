package io.github.flameyossnowy.network.sql.internals;

import io.github.flameyossnowy.network.api.exceptions.StoreException;
import io.github.flameyossnowy.network.api.utils.Logging;
import io.github.flameyossnowy.network.sql.RowMapper;
import io.github.flameyossnowy.network.sql.connections.SQLConnectionProvider;
import io.github.flameyossnowy.network.sql.query.SqlQuery;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@link SqlQuery}s on a fresh connection each, translating {@link SQLException}
 * into {@link StoreException}.
 */
public final class SqlQueryExecutor {
    private final SQLConnectionProvider connectionProvider;

    public SqlQueryExecutor(SQLConnectionProvider connectionProvider) {
        this.connectionProvider = connectionProvider;
    }

    public <T> List<T> list(SqlQuery query, RowMapper<T> mapper) {
        Logging.deepInfo(() -> "Executing " + query.sql() + " " + query.parameters());
        try (Connection connection = connectionProvider.getConnection();
             PreparedStatement statement = prepare(connection, query);
             ResultSet resultSet = statement.executeQuery()) {
            List<T> rows = new ArrayList<>();
            while (resultSet.next()) {
                rows.add(mapper.map(resultSet));
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Failed to execute query: " + query.sql(), e);
        }
    }

    public long count(SqlQuery query) {
        List<Long> rows = list(query.count(), resultSet -> resultSet.getLong(1));
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    public boolean exists(SqlQuery query) {
        return !list(query.exists(), resultSet -> Boolean.TRUE).isEmpty();
    }

    public int update(SqlQuery query) {
        Logging.deepInfo(() -> "Executing " + query.sql() + " " + query.parameters());
        try (Connection connection = connectionProvider.getConnection();
             PreparedStatement statement = prepare(connection, query)) {
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to execute update: " + query.sql(), e);
        }
    }

    private static PreparedStatement prepare(Connection connection, SqlQuery query) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(query.sql());
        try {
            List<Object> parameters = query.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                Object value = parameters.get(i);
                if (value instanceof Boolean bool) {
                    statement.setBoolean(i + 1, bool);
                } else {
                    statement.setObject(i + 1, value);
                }
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }
}

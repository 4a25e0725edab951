package io.github.flameyossnowy.network.sql.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;

/**
 * A SQL string with its positional parameters.
 */
public record SqlQuery(String sql, List<Object> parameters) {
    public SqlQuery {
        parameters = List.copyOf(parameters);
    }

    /**
     * {@code SELECT COUNT(*)} over this query.
     */
    public SqlQuery count() {
        return new SqlQuery("SELECT COUNT(*) FROM (" + sql + ") q", parameters);
    }

    /**
     * A query returning at most one row iff this query returns any.
     */
    public SqlQuery exists() {
        return new SqlQuery("SELECT 1 FROM (" + sql + ") q LIMIT 1", parameters);
    }

    /**
     * Restricts this query to rows whose {@code idColumn} is one of {@code ids}.
     */
    public SqlQuery whereIdIn(String idColumn, Collection<?> ids) {
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (int i = 0; i < ids.size(); i++) placeholders.add("?");

        List<Object> params = new ArrayList<>(parameters.size() + ids.size());
        params.addAll(parameters);
        params.addAll(ids);
        return new SqlQuery("SELECT * FROM (" + sql + ") q WHERE q." + idColumn + " IN " + placeholders, params);
    }
}

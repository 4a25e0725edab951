package io.github.flameyossnowy.network.sql;

import io.github.flameyossnowy.network.api.LinkedRecordSet;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.store.JoinTableMapping;
import io.github.flameyossnowy.network.sql.internals.SqlQueryExecutor;
import io.github.flameyossnowy.network.sql.query.SqlQuery;

import java.util.List;
import java.util.Objects;

final class JdbcLinkedRecordSet<T, ID> extends JdbcRecordSet<T, ID> implements LinkedRecordSet<T, ID> {
    private final JoinTableMapping mapping;
    private final ID ownerId;

    JdbcLinkedRecordSet(
        EntityModel<T, ID> model,
        RowMapper<T> mapper,
        SqlQueryExecutor executor,
        SqlQuery query,
        JoinTableMapping mapping,
        ID ownerId
    ) {
        super(model, mapper, executor, query);
        this.mapping = mapping;
        this.ownerId = ownerId;
    }

    @Override
    public void link(T other) {
        Objects.requireNonNull(other, "Linked record cannot be null");
        ID otherId = model.getPrimaryKeyValue(other);
        if (ownerId == null || otherId == null) {
            throw new IllegalStateException("Cannot link unsaved records through " + mapping.table());
        }
        executor.update(new SqlQuery(
            "INSERT INTO " + mapping.table() + " (" + mapping.localKey() + ", " + mapping.remoteKey() + ") VALUES (?, ?)",
            List.of(ownerId, otherId)
        ));
    }

    @Override
    public boolean unlink(T other) {
        Objects.requireNonNull(other, "Unlinked record cannot be null");
        ID otherId = model.getPrimaryKeyValue(other);
        if (ownerId == null || otherId == null) return false;
        return executor.update(new SqlQuery(
            "DELETE FROM " + mapping.table() + " WHERE " + mapping.localKey() + " = ? AND " + mapping.remoteKey() + " = ?",
            List.of(ownerId, otherId)
        )) > 0;
    }
}

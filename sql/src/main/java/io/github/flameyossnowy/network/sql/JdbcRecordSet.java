package io.github.flameyossnowy.network.sql;

import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.sql.internals.SqlQueryExecutor;
import io.github.flameyossnowy.network.sql.query.SqlQuery;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A relation query that runs against the database on every call.
 * Id lookups are pushed down as {@code IN (...)} and split into batches.
 */
class JdbcRecordSet<T, ID> implements RecordSet<T, ID> {
    static final int ID_BATCH_SIZE = 500;

    protected final EntityModel<T, ID> model;
    protected final SqlQueryExecutor executor;
    private final RowMapper<T> mapper;
    private final SqlQuery query;

    JdbcRecordSet(EntityModel<T, ID> model, RowMapper<T> mapper, SqlQueryExecutor executor, SqlQuery query) {
        this.model = model;
        this.mapper = mapper;
        this.executor = executor;
        this.query = query;
    }

    @Override
    public int size() {
        return Math.toIntExact(executor.count(query));
    }

    @Override
    public boolean isEmpty() {
        return !executor.exists(query);
    }

    @Override
    public @NotNull Iterator<T> iterator() {
        return executor.list(query, mapper).iterator();
    }

    @Override
    public List<T> toList() {
        return executor.list(query, mapper);
    }

    @Override
    public List<T> whereIdIn(Collection<? extends ID> ids) {
        List<T> matches = new ArrayList<>();
        if (ids.isEmpty()) return matches;

        List<ID> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        for (int from = 0; from < distinct.size(); from += ID_BATCH_SIZE) {
            List<ID> batch = distinct.subList(from, Math.min(from + ID_BATCH_SIZE, distinct.size()));
            matches.addAll(executor.list(query.whereIdIn(model.idColumn(), batch), mapper));
        }
        return matches;
    }

    @Override
    public ID idOf(T record) {
        return model.getPrimaryKeyValue(record);
    }

    @Override
    public String toString() {
        return "JdbcRecordSet{" + query.sql() + " " + query.parameters() + "}";
    }
}

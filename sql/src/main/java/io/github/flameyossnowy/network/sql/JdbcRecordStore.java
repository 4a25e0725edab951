package io.github.flameyossnowy.network.sql;

import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.api.store.JoinTableMapping;
import io.github.flameyossnowy.network.api.store.LinkAccessor;
import io.github.flameyossnowy.network.api.store.RelationAccessor;
import io.github.flameyossnowy.network.api.store.RelationStore;
import io.github.flameyossnowy.network.api.store.ThroughMapping;
import io.github.flameyossnowy.network.api.utils.Logging;
import io.github.flameyossnowy.network.sql.connections.SQLConnectionProvider;
import io.github.flameyossnowy.network.sql.internals.SqlQueryExecutor;
import io.github.flameyossnowy.network.sql.query.SqlConditionBuilder;
import io.github.flameyossnowy.network.sql.query.SqlQuery;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RelationStore} backed by a relational database. Each accessor evaluation
 * builds a parameterized query; nothing is cached between calls.
 *
 * <pre>{@code
 * JdbcRecordStore store = JdbcRecordStore.builder(new SimpleConnectionProvider("jdbc:sqlite:people.db"))
 *     .register(PERSON, rs -> new Person(rs.getLong("id"), rs.getString("name")))
 *     .register(INVITE, Invite::fromRow)
 *     .build();
 * }</pre>
 */
public final class JdbcRecordStore implements RelationStore {
    private final SqlQueryExecutor executor;
    private final Map<String, RowMapper<?>> mappers;

    private JdbcRecordStore(SqlQueryExecutor executor, Map<String, RowMapper<?>> mappers) {
        this.executor = executor;
        this.mappers = Map.copyOf(mappers);
    }

    @Contract("_ -> new")
    public static @NotNull Builder builder(@NotNull SQLConnectionProvider connectionProvider) {
        return new Builder(connectionProvider);
    }

    /**
     * Every row of the model's table.
     */
    public <T, ID> @NotNull RecordSet<T, ID> all(@NotNull EntityModel<T, ID> model) {
        return new JdbcRecordSet<>(model, mapper(model), executor,
            new SqlQuery("SELECT t.* FROM " + model.tableName() + " t", List.of()));
    }

    @Override
    public <N, ID> @NotNull LinkAccessor<N, ID> manyToMany(
        @NotNull EntityModel<N, ID> node,
        @NotNull JoinTableMapping joinTable,
        @Nullable RelationFilter filter
    ) {
        RowMapper<N> mapper = mapper(node);
        String base = "SELECT n.* FROM " + node.tableName() + " n INNER JOIN " + joinTable.table() + " j"
            + " ON n." + node.idColumn() + " = j." + joinTable.remoteKey()
            + " WHERE j." + joinTable.localKey() + " = ?";
        Logging.deepInfo(() -> "Prepared many-to-many query: " + base);

        return owner -> {
            ID ownerId = node.getPrimaryKeyValue(owner);
            return new JdbcLinkedRecordSet<>(node, mapper, executor, bind(base, ownerId, "n", filter), joinTable, ownerId);
        };
    }

    @Override
    public <O, OID, E, EID> @NotNull RelationAccessor<O, E, EID> oneToMany(
        @NotNull EntityModel<O, OID> owner,
        @NotNull EntityModel<E, EID> target,
        @NotNull String foreignKey,
        @Nullable RelationFilter filter
    ) {
        RowMapper<E> mapper = mapper(target);
        String base = "SELECT t.* FROM " + target.tableName() + " t WHERE t." + foreignKey + " = ?";
        Logging.deepInfo(() -> "Prepared one-to-many query: " + base);

        return entity -> new JdbcRecordSet<>(target, mapper, executor,
            bind(base, owner.getPrimaryKeyValue(entity), "t", filter));
    }

    @Override
    public <N, ID, E, EID> @NotNull RelationAccessor<N, N, ID> through(
        @NotNull EntityModel<N, ID> node,
        @NotNull ThroughMapping<E, EID> through,
        @Nullable RelationFilter filter
    ) {
        RowMapper<N> mapper = mapper(node);
        String base = "SELECT n.* FROM " + node.tableName() + " n INNER JOIN " + through.edge().tableName() + " e"
            + " ON n." + node.idColumn() + " = e." + through.sourceKey()
            + " WHERE e." + through.localKey() + " = ?";
        Logging.deepInfo(() -> "Prepared through query: " + base);

        return owner -> new JdbcRecordSet<>(node, mapper, executor,
            bind(base, node.getPrimaryKeyValue(owner), "e", filter));
    }

    private static SqlQuery bind(String base, @Nullable Object ownerId, String filterAlias, @Nullable RelationFilter filter) {
        // an unsaved owner has no related rows
        if (ownerId == null) {
            return new SqlQuery(base.substring(0, base.lastIndexOf(" WHERE ")) + " WHERE 1 = 0", List.of());
        }

        StringBuilder sql = new StringBuilder(base);
        List<Object> parameters = new ArrayList<>(4);
        parameters.add(ownerId);
        SqlConditionBuilder.append(sql, parameters, filterAlias, filter);
        return new SqlQuery(sql.toString(), parameters);
    }

    @SuppressWarnings("unchecked")
    private <T> RowMapper<T> mapper(EntityModel<T, ?> model) {
        RowMapper<T> mapper = (RowMapper<T>) mappers.get(model.tableName());
        if (mapper == null) {
            throw new IllegalArgumentException("No row mapper registered for table " + model.tableName());
        }
        return mapper;
    }

    public static final class Builder {
        private final SQLConnectionProvider connectionProvider;
        private final Map<String, RowMapper<?>> mappers = new HashMap<>();

        private Builder(SQLConnectionProvider connectionProvider) {
            this.connectionProvider = Objects.requireNonNull(connectionProvider, "Connection provider cannot be null");
        }

        /**
         * Registers how rows of the model's table are turned into entities.
         */
        public <T> Builder register(@NotNull EntityModel<T, ?> model, @NotNull RowMapper<T> mapper) {
            Objects.requireNonNull(model, "Model cannot be null");
            Objects.requireNonNull(mapper, "Row mapper cannot be null");
            mappers.put(model.tableName(), mapper);
            return this;
        }

        public JdbcRecordStore build() {
            return new JdbcRecordStore(new SqlQueryExecutor(connectionProvider), mappers);
        }
    }
}

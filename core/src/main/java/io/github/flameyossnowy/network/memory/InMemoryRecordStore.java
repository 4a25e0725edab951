package io.github.flameyossnowy.network.memory;

import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.api.store.JoinTableMapping;
import io.github.flameyossnowy.network.api.store.LinkAccessor;
import io.github.flameyossnowy.network.api.store.RelationAccessor;
import io.github.flameyossnowy.network.api.store.RelationStore;
import io.github.flameyossnowy.network.api.store.ThroughMapping;
import io.github.flameyossnowy.network.api.utils.Logging;
import io.github.flameyossnowy.network.api.utils.Values;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Heap-backed {@link RelationStore}. Entity tables are keyed by primary key and keep
 * insertion order; join tables are lists of column maps.
 * <p>
 * Records are stored by reference, so mutating a saved entity is visible to later queries.
 * Not thread-safe.
 */
@SuppressWarnings("unchecked")
public class InMemoryRecordStore implements RelationStore {
    private final Map<String, Map<Object, Object>> tables = new HashMap<>();
    private final Map<String, List<Map<String, Object>>> joinTables = new HashMap<>();

    /**
     * Inserts or replaces an entity by primary key.
     *
     * @throws IllegalArgumentException if the entity has no primary key
     */
    public <T, ID> T save(@NotNull EntityModel<T, ID> model, @NotNull T entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        ID id = model.getPrimaryKeyValue(entity);
        if (id == null) {
            throw new IllegalArgumentException("Cannot save " + model.name() + " without a primary key");
        }
        table(model.tableName()).put(Values.key(id), entity);
        return entity;
    }

    public <T, ID> void saveAll(@NotNull EntityModel<T, ID> model, @NotNull Collection<? extends T> entities) {
        for (T entity : entities) save(model, entity);
    }

    /**
     * Removes an entity. Join rows and edges pointing at it are left in place and
     * simply stop resolving.
     */
    public <T, ID> boolean delete(@NotNull EntityModel<T, ID> model, @NotNull ID id) {
        return table(model.tableName()).remove(Values.key(id)) != null;
    }

    public <T, ID> @Nullable T get(@NotNull EntityModel<T, ID> model, @Nullable Object id) {
        return (T) table(model.tableName()).get(Values.key(id));
    }

    /**
     * Every entity of a table, in insertion order.
     */
    public <T, ID> @NotNull RecordSet<T, ID> all(@NotNull EntityModel<T, ID> model) {
        return new InMemoryRecordSet<>(model, () -> select(model, record -> true));
    }

    public void insertJoinRow(@NotNull String joinTable, @NotNull Map<String, ?> row) {
        joinRows(joinTable).add(new LinkedHashMap<>(row));
    }

    public int joinRowCount(@NotNull String joinTable) {
        return joinRows(joinTable).size();
    }

    void link(JoinTableMapping mapping, @Nullable Object localId, @Nullable Object remoteId) {
        if (localId == null || remoteId == null) {
            throw new IllegalStateException("Cannot link unsaved records through " + mapping.table());
        }
        Map<String, Object> row = new LinkedHashMap<>(4);
        row.put(mapping.localKey(), localId);
        row.put(mapping.remoteKey(), remoteId);
        joinRows(mapping.table()).add(row);
        Logging.deepInfo(() -> "Linked " + mapping.table() + " " + row);
    }

    boolean unlink(JoinTableMapping mapping, @Nullable Object localId, @Nullable Object remoteId) {
        boolean removed = false;
        Iterator<Map<String, Object>> rows = joinRows(mapping.table()).iterator();
        while (rows.hasNext()) {
            Map<String, Object> row = rows.next();
            if (Values.same(row.get(mapping.localKey()), localId) && Values.same(row.get(mapping.remoteKey()), remoteId)) {
                rows.remove();
                removed = true;
            }
        }
        return removed;
    }

    public void clear() {
        tables.clear();
        joinTables.clear();
    }

    @Override
    public <N, ID> @NotNull LinkAccessor<N, ID> manyToMany(
        @NotNull EntityModel<N, ID> node,
        @NotNull JoinTableMapping joinTable,
        @Nullable RelationFilter filter
    ) {
        return owner -> {
            ID ownerId = node.getPrimaryKeyValue(owner);
            return new InMemoryLinkedRecordSet<>(this, node, joinTable, ownerId, () -> {
                List<N> nodes = new ArrayList<>();
                for (Map<String, Object> row : joinRows(joinTable.table())) {
                    if (!Values.same(row.get(joinTable.localKey()), ownerId)) continue;
                    N related = get(node, row.get(joinTable.remoteKey()));
                    if (related != null && (filter == null || filter.test(node, related))) {
                        nodes.add(related);
                    }
                }
                return nodes;
            });
        };
    }

    @Override
    public <O, OID, E, EID> @NotNull RelationAccessor<O, E, EID> oneToMany(
        @NotNull EntityModel<O, OID> owner,
        @NotNull EntityModel<E, EID> target,
        @NotNull String foreignKey,
        @Nullable RelationFilter filter
    ) {
        return entity -> {
            OID ownerId = owner.getPrimaryKeyValue(entity);
            return new InMemoryRecordSet<>(target, () -> select(target, row ->
                Values.same(target.getValue(row, foreignKey), ownerId) && (filter == null || filter.test(target, row))));
        };
    }

    @Override
    public <N, ID, E, EID> @NotNull RelationAccessor<N, N, ID> through(
        @NotNull EntityModel<N, ID> node,
        @NotNull ThroughMapping<E, EID> through,
        @Nullable RelationFilter filter
    ) {
        EntityModel<E, EID> edge = through.edge();
        return owner -> {
            ID ownerId = node.getPrimaryKeyValue(owner);
            return new InMemoryRecordSet<>(node, () -> {
                List<N> nodes = new ArrayList<>();
                for (E row : select(edge, e -> Values.same(edge.getValue(e, through.localKey()), ownerId))) {
                    if (filter != null && !filter.test(edge, row)) continue;
                    N related = get(node, edge.getValue(row, through.sourceKey()));
                    if (related != null) nodes.add(related);
                }
                return nodes;
            });
        };
    }

    private <T> List<T> select(EntityModel<T, ?> model, Predicate<T> predicate) {
        List<T> out = new ArrayList<>();
        for (Object record : table(model.tableName()).values()) {
            T typed = (T) record;
            if (predicate.test(typed)) out.add(typed);
        }
        return out;
    }

    private Map<Object, Object> table(String name) {
        return tables.computeIfAbsent(name, k -> new LinkedHashMap<>());
    }

    private List<Map<String, Object>> joinRows(String name) {
        return joinTables.computeIfAbsent(name, k -> new ArrayList<>());
    }
}

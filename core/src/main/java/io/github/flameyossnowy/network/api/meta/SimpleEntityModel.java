package io.github.flameyossnowy.network.api.meta;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Function-backed {@link EntityModel}, produced by {@link EntityModel.Builder}.
 */
final class SimpleEntityModel<T, ID> implements EntityModel<T, ID> {
    private final Class<T> entityClass;
    private final Class<ID> idClass;
    private final String name;
    private final String tableName;
    private final String idColumn;
    private final Function<? super T, ? extends ID> idReader;
    private final Map<String, Function<? super T, ?>> columns;
    private final String foreignKey;

    SimpleEntityModel(
        Class<T> entityClass,
        Class<ID> idClass,
        String name,
        String tableName,
        String idColumn,
        Function<? super T, ? extends ID> idReader,
        Map<String, Function<? super T, ?>> columns,
        @Nullable String foreignKey
    ) {
        this.entityClass = entityClass;
        this.idClass = idClass;
        this.name = name;
        this.tableName = tableName;
        this.idColumn = idColumn;
        this.idReader = idReader;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.foreignKey = foreignKey;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public String idColumn() {
        return idColumn;
    }

    @Override
    public Class<T> getEntityClass() {
        return entityClass;
    }

    @Override
    public Class<ID> getIdClass() {
        return idClass;
    }

    @Override
    public ID getPrimaryKeyValue(@NotNull T entity) {
        return idReader.apply(entity);
    }

    @Override
    public Set<String> columns() {
        return columns.keySet();
    }

    @Override
    public @Nullable Object getValue(@NotNull T entity, String column) {
        Function<? super T, ?> reader = columns.get(column);
        if (reader == null) {
            throw new IllegalArgumentException("Unknown column " + column + " on " + name);
        }
        return reader.apply(entity);
    }

    @Override
    public String foreignKey() {
        return foreignKey != null ? foreignKey : EntityModel.super.foreignKey();
    }

    @Override
    public String toString() {
        return "EntityModel{" + name + " -> " + tableName + "}";
    }
}

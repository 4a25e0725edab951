package io.github.flameyossnowy.network.api.meta;

import io.github.flameyossnowy.network.api.utils.Identifiers;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Represents metadata about an entity that takes part in relations.
 * Generic types:
 * - T: The entity type
 * - ID: The primary key type
 */
public interface EntityModel<T, ID> {
    /**
     * Entity name, e.g. {@code Person}.
     */
    String name();

    /**
     * Table or collection name, e.g. {@code people}.
     */
    String tableName();

    String idColumn();

    Class<T> getEntityClass();

    Class<ID> getIdClass();

    ID getPrimaryKeyValue(T entity);

    /**
     * Every readable column, the id column included.
     */
    Set<String> columns();

    /**
     * Reads a column value from an entity.
     *
     * @throws IllegalArgumentException if the column is not declared on this model
     */
    @Nullable
    Object getValue(T entity, String column);

    default boolean hasColumn(String column) {
        return columns().contains(column);
    }

    /**
     * Default foreign key used by other tables to reference this entity, {@code person_id} for {@code Person}.
     */
    default String foreignKey() {
        return Identifiers.snakeCase(name()) + "_id";
    }

    static <T, ID> @NotNull Builder<T, ID> builder(@NotNull Class<T> entityClass, @NotNull Class<ID> idClass) {
        return new Builder<>(entityClass, idClass);
    }

    final class Builder<T, ID> {
        private final Class<T> entityClass;
        private final Class<ID> idClass;
        private final LinkedHashMap<String, Function<? super T, ?>> columns = new LinkedHashMap<>();

        private String name;
        private String tableName;
        private String idColumn;
        private Function<? super T, ? extends ID> idReader;
        private String foreignKey;

        Builder(Class<T> entityClass, Class<ID> idClass) {
            this.entityClass = Objects.requireNonNull(entityClass, "Entity class cannot be null");
            this.idClass = Objects.requireNonNull(idClass, "Id class cannot be null");
            this.name = entityClass.getSimpleName();
        }

        public Builder<T, ID> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<T, ID> table(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder<T, ID> id(String column, Function<? super T, ? extends ID> reader) {
            this.idColumn = column;
            this.idReader = reader;
            this.columns.put(column, reader);
            return this;
        }

        public Builder<T, ID> column(String column, Function<? super T, ?> reader) {
            this.columns.put(column, reader);
            return this;
        }

        /**
         * Overrides the derived {@code <name>_id} foreign key.
         */
        public Builder<T, ID> foreignKey(String foreignKey) {
            this.foreignKey = foreignKey;
            return this;
        }

        public EntityModel<T, ID> build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Entity name cannot be blank");
            }
            if (!Identifiers.isIdentifier(tableName)) {
                throw new IllegalArgumentException("Invalid table name for " + name + ": " + tableName);
            }
            if (idReader == null || !Identifiers.isIdentifier(idColumn)) {
                throw new IllegalArgumentException("Entity " + name + " must declare a valid id column");
            }
            for (String column : columns.keySet()) {
                if (!Identifiers.isIdentifier(column)) {
                    throw new IllegalArgumentException("Invalid column name on " + name + ": " + column);
                }
            }
            return new SimpleEntityModel<>(entityClass, idClass, name, tableName, idColumn, idReader, columns, foreignKey);
        }
    }
}

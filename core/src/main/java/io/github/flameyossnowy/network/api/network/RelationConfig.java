package io.github.flameyossnowy.network.api.network;

import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Declarative configuration of one network relation. Every field is optional;
 * unset names are derived when the network is declared.
 *
 * <pre>{@code
 * // people_people join table, person_id -> person_id_target
 * RelationConfig.defaults();
 *
 * // Invite edge entity, only accepted invites count
 * RelationConfig.builder()
 *     .through("invites")
 *     .filter(RelationFilter.where("is_accepted").eq(true))
 *     .build();
 * }</pre>
 *
 * @param through               name of the edge entity, resolved through the entity registry
 * @param throughModel          the edge entity model itself, instead of a name
 * @param joinTable             join table used when there is no edge entity
 * @param foreignKey            column holding the origin node's id
 * @param associationForeignKey column holding the target node's id
 * @param filter                applied to node rows in join-table mode, to edge rows otherwise
 */
public record RelationConfig(
    @Nullable String through,
    @Nullable EntityModel<?, ?> throughModel,
    @Nullable String joinTable,
    @Nullable String foreignKey,
    @Nullable String associationForeignKey,
    @Nullable RelationFilter filter
) {
    @Contract(" -> new")
    public static @NotNull RelationConfig defaults() {
        return new RelationConfig(null, null, null, null, null, null);
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public boolean hasThrough() {
        return through != null || throughModel != null;
    }

    public static final class Builder {
        private String through;
        private EntityModel<?, ?> throughModel;
        private String joinTable;
        private String foreignKey;
        private String associationForeignKey;
        private RelationFilter filter;

        private Builder() {}

        public Builder through(String through) {
            this.through = through;
            this.throughModel = null;
            return this;
        }

        public Builder through(EntityModel<?, ?> throughModel) {
            this.throughModel = throughModel;
            this.through = null;
            return this;
        }

        public Builder joinTable(String joinTable) {
            this.joinTable = joinTable;
            return this;
        }

        public Builder foreignKey(String foreignKey) {
            this.foreignKey = foreignKey;
            return this;
        }

        public Builder associationForeignKey(String associationForeignKey) {
            this.associationForeignKey = associationForeignKey;
            return this;
        }

        public Builder filter(RelationFilter filter) {
            this.filter = filter;
            return this;
        }

        public RelationConfig build() {
            return new RelationConfig(through, throughModel, joinTable, foreignKey, associationForeignKey, filter);
        }
    }
}

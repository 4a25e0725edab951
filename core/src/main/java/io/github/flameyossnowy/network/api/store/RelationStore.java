package io.github.flameyossnowy.network.api.store;

import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Relation-declaration primitives a backing store provides.
 * <p>
 * Each method is called once while a node type is declared and returns an accessor
 * that queries the store every time it is evaluated. Filters are handed over as
 * values and evaluated by the store at query time.
 */
public interface RelationStore {
    /**
     * Nodes reachable through {@code joinTable}: join rows whose local key equals the
     * owner's id, resolved to the node named by the remote key. The filter applies to
     * the resolved nodes.
     */
    <N, ID> @NotNull LinkAccessor<N, ID> manyToMany(
        @NotNull EntityModel<N, ID> node,
        @NotNull JoinTableMapping joinTable,
        @Nullable RelationFilter filter
    );

    /**
     * Target records whose {@code foreignKey} column equals the owner's id.
     */
    <O, OID, E, EID> @NotNull RelationAccessor<O, E, EID> oneToMany(
        @NotNull EntityModel<O, OID> owner,
        @NotNull EntityModel<E, EID> target,
        @NotNull String foreignKey,
        @Nullable RelationFilter filter
    );

    /**
     * Nodes on the far side of the owner's edges: edges whose local key equals the
     * owner's id, resolved to the node named by the source key. The filter applies to
     * the edge rows, not to the nodes.
     */
    <N, ID, E, EID> @NotNull RelationAccessor<N, N, ID> through(
        @NotNull EntityModel<N, ID> node,
        @NotNull ThroughMapping<E, EID> through,
        @Nullable RelationFilter filter
    );
}

package io.github.flameyossnowy.network.api.network;

import io.github.flameyossnowy.network.api.exceptions.NetworkConfigurationException;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.meta.EntityRegistry;
import io.github.flameyossnowy.network.api.meta.RelationKind;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.api.store.JoinTableMapping;
import io.github.flameyossnowy.network.api.store.RelationAccessor;
import io.github.flameyossnowy.network.api.store.RelationStore;
import io.github.flameyossnowy.network.api.store.ThroughMapping;
import io.github.flameyossnowy.network.api.union.UnionRegistrar;
import io.github.flameyossnowy.network.api.utils.Identifiers;
import io.github.flameyossnowy.network.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Turns a network declaration into the accessors bound on a node type.
 * <p>
 * For a network {@code friends} in join-table mode this yields {@code friends_out},
 * {@code friends_in} and the union {@code friends}. With an edge entity {@code invites}
 * it also yields {@code invites_out}, {@code invites_in} and the union {@code invites}
 * over the raw edges.
 */
public final class NetworkRelationBuilder<N, ID> {
    private final EntityModel<N, ID> node;
    private final RelationStore store;
    private final EntityRegistry registry;

    public NetworkRelationBuilder(
        @NotNull EntityModel<N, ID> node,
        @NotNull RelationStore store,
        @NotNull EntityRegistry registry
    ) {
        this.node = Objects.requireNonNull(node, "Node model cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.registry = Objects.requireNonNull(registry, "Entity registry cannot be null");
    }

    /**
     * Applies the naming defaults and validates the result.
     *
     * @throws NetworkConfigurationException if a name is missing, malformed or cannot be resolved
     */
    public @NotNull ResolvedNetwork resolve(String name, @NotNull RelationConfig config) {
        Objects.requireNonNull(config, "Relation config cannot be null");
        if (!Identifiers.isIdentifier(name)) {
            throw new NetworkConfigurationException(name, "network name must be a valid identifier");
        }

        String foreignKey = config.foreignKey() != null ? config.foreignKey() : node.foreignKey();
        String associationForeignKey = config.associationForeignKey() != null
            ? config.associationForeignKey()
            : foreignKey + "_target";

        requireIdentifier(name, "foreign key", foreignKey);
        requireIdentifier(name, "association foreign key", associationForeignKey);
        if (foreignKey.equals(associationForeignKey)) {
            throw new NetworkConfigurationException(name, "foreign key and association foreign key are both '" + foreignKey + "'");
        }

        RelationFilter filter = config.filter();
        if (filter != null && filter.options().isEmpty()) {
            filter = null;
        }

        if (!config.hasThrough()) {
            String joinTable = config.joinTable() != null
                ? config.joinTable()
                : node.tableName() + "_" + node.tableName();
            requireIdentifier(name, "join table", joinTable);
            requireColumns(name, node, filter);
            return new ResolvedNetwork(name, null, null, joinTable, foreignKey, associationForeignKey, filter);
        }

        String throughName;
        EntityModel<?, ?> through;
        if (config.throughModel() != null) {
            through = config.throughModel();
            throughName = through.tableName();
        } else {
            throughName = config.through();
            requireIdentifier(name, "through entity", throughName);
            through = registry.get(throughName);
            if (through == null) {
                throw new NetworkConfigurationException(name, "through entity '" + throughName + "' is not registered");
            }
        }

        if (config.joinTable() != null) {
            Logging.warn("Network '" + name + "' on " + node.tableName() + " ignores join table "
                + config.joinTable() + " in favour of " + through.tableName());
        }
        for (String key : List.of(foreignKey, associationForeignKey)) {
            if (!through.hasColumn(key)) {
                throw new NetworkConfigurationException(name, "edge entity " + through.name() + " has no column '" + key + "'");
            }
        }
        requireColumns(name, through, filter);

        return new ResolvedNetwork(name, throughName, through, null, foreignKey, associationForeignKey, filter);
    }

    /**
     * The bindings a resolved network contributes, in declaration order.
     *
     * @param resolver looks up bindings of the node type, used by the union accessors at call time
     */
    public @NotNull List<RelationBinding<N>> bindings(
        @NotNull ResolvedNetwork network,
        @NotNull Function<String, RelationBinding<N>> resolver
    ) {
        List<RelationBinding<N>> bindings = new ArrayList<>(6);
        if (network.isThrough()) {
            addThroughBindings(network, network.through(), bindings, resolver);
        } else {
            JoinTableMapping out = new JoinTableMapping(network.joinTable(), network.foreignKey(), network.associationForeignKey());
            bindings.add(manyToMany(network.outName(), out, network.filter()));
            bindings.add(manyToMany(network.inName(), out.inverse(), network.filter()));

            Logging.info("Declared network '" + network.name() + "' on " + node.tableName()
                + " via join table " + out.table() + " (" + out.localKey() + " -> " + out.remoteKey() + ")");
        }

        bindings.add(UnionRegistrar.union(network.name(), List.of(network.outName(), network.inName()), resolver));
        return bindings;
    }

    private <E, EID> void addThroughBindings(
        ResolvedNetwork network,
        EntityModel<E, EID> edge,
        List<RelationBinding<N>> bindings,
        Function<String, RelationBinding<N>> resolver
    ) {
        String edgesOut = network.throughName() + "_out";
        String edgesIn = network.throughName() + "_in";

        bindings.add(oneToMany(edgesOut, edge, network.foreignKey(), null));
        bindings.add(oneToMany(edgesIn, edge, network.associationForeignKey(), null));

        ThroughMapping<E, EID> out = new ThroughMapping<>(edge, network.foreignKey(), network.associationForeignKey());
        bindings.add(through(network.outName(), out, network.filter()));
        bindings.add(through(network.inName(), out.inverse(), network.filter()));

        bindings.add(UnionRegistrar.union(network.throughName(), List.of(edgesOut, edgesIn), resolver));

        Logging.info("Declared network '" + network.name() + "' on " + node.tableName()
            + " through " + edge.tableName() + " (" + out.localKey() + " -> " + out.sourceKey() + ")"
            + (network.filter() == null ? "" : " where " + network.filter()));
    }

    RelationBinding<N> manyToMany(String name, JoinTableMapping mapping, @Nullable RelationFilter filter) {
        return new RelationBinding<>(
            name,
            RelationKind.MANY_TO_MANY,
            "many-to-many " + mapping.table() + "(" + mapping.localKey() + " -> " + mapping.remoteKey() + ")" + describe(filter),
            declare(name, () -> store.manyToMany(node, mapping, filter)),
            List.of()
        );
    }

    <E, EID> RelationBinding<N> oneToMany(String name, EntityModel<E, EID> target, String foreignKey, @Nullable RelationFilter filter) {
        return new RelationBinding<>(
            name,
            RelationKind.ONE_TO_MANY,
            "one-to-many " + target.tableName() + "." + foreignKey + describe(filter),
            declare(name, () -> store.oneToMany(node, target, foreignKey, filter)),
            List.of()
        );
    }

    private <E, EID> RelationBinding<N> through(String name, ThroughMapping<E, EID> mapping, @Nullable RelationFilter filter) {
        return new RelationBinding<>(
            name,
            RelationKind.THROUGH,
            "through " + mapping.edge().tableName() + "(" + mapping.localKey() + " -> " + mapping.sourceKey() + ")" + describe(filter),
            declare(name, () -> store.through(node, mapping, filter)),
            List.of()
        );
    }

    /**
     * Runs a store primitive, reporting a store that cannot serve the relation as a configuration error.
     */
    private static <A extends RelationAccessor<?, ?, ?>> A declare(String name, Supplier<A> primitive) {
        try {
            return primitive.get();
        } catch (IllegalArgumentException e) {
            throw new NetworkConfigurationException(name, "store rejected the relation: " + e.getMessage(), e);
        }
    }

    private static String describe(@Nullable RelationFilter filter) {
        return filter == null ? "" : " where " + filter;
    }

    static void requireIdentifier(String relation, String what, @Nullable String value) {
        if (!Identifiers.isIdentifier(value)) {
            throw new NetworkConfigurationException(relation, what + " '" + value + "' is not a valid identifier");
        }
    }

    static void requireColumns(String relation, EntityModel<?, ?> model, @Nullable RelationFilter filter) {
        if (filter == null) return;
        for (String column : filter.columns()) {
            if (!model.hasColumn(column)) {
                throw new NetworkConfigurationException(relation, "filter column '" + column + "' does not exist on " + model.name());
            }
        }
    }
}

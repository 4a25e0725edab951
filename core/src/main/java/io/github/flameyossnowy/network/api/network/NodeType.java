package io.github.flameyossnowy.network.api.network;

import io.github.flameyossnowy.network.api.LinkedRecordSet;
import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.exceptions.NetworkConfigurationException;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.meta.EntityRegistry;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.api.store.RelationStore;
import io.github.flameyossnowy.network.api.union.UnionRegistrar;
import io.github.flameyossnowy.network.api.union.UnionView;
import io.github.flameyossnowy.network.api.utils.Identifiers;
import io.github.flameyossnowy.network.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The relations an entity type takes part in, as a fixed table of named accessors.
 * <p>
 * A node type is declared once, usually in a static initializer, and is immutable afterwards:
 *
 * <pre>{@code
 * static final NodeType<Person, Long> PEOPLE = NodeType.builder(PERSON, store, registry)
 *     .declareNetwork("friends", RelationConfig.builder().joinTable("friends").build())
 *     .declareNetwork("colleagues", RelationConfig.builder()
 *         .through("invites")
 *         .filter(RelationFilter.where("is_accepted").eq(true))
 *         .build())
 *     .declareUnion("associates", "friends", "colleagues")
 *     .build();
 *
 * UnionView<Person, Long> associates = PEOPLE.union(jane, "associates");
 * }</pre>
 *
 * @param <N>  the node type
 * @param <ID> the node's primary key type
 */
public final class NodeType<N, ID> {
    private final EntityModel<N, ID> model;
    private final Map<String, RelationBinding<N>> bindings;

    private NodeType(EntityModel<N, ID> model, Map<String, RelationBinding<N>> bindings) {
        this.model = model;
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    @Contract("_, _, _ -> new")
    public static <N, ID> @NotNull Builder<N, ID> builder(
        @NotNull EntityModel<N, ID> model,
        @NotNull RelationStore store,
        @NotNull EntityRegistry registry
    ) {
        return new Builder<>(model, store, registry);
    }

    /**
     * Builder for node types whose networks only use join tables or pass edge models directly.
     */
    @Contract("_, _ -> new")
    public static <N, ID> @NotNull Builder<N, ID> builder(@NotNull EntityModel<N, ID> model, @NotNull RelationStore store) {
        return new Builder<>(model, store, new EntityRegistry().add(model));
    }

    public EntityModel<N, ID> model() {
        return model;
    }

    /**
     * Evaluates the named accessor on a node.
     *
     * @throws IllegalArgumentException if no such relation is declared
     */
    @SuppressWarnings("unchecked")
    public <R, RID> @Nullable RecordSet<R, RID> relation(@NotNull N node, String name) {
        Objects.requireNonNull(node, "Node cannot be null");
        return (RecordSet<R, RID>) require(name).accessor().fetch(node);
    }

    /**
     * Evaluates a union accessor, e.g. the bidirectional view of a network.
     *
     * @throws IllegalArgumentException if the relation is not a union
     */
    @SuppressWarnings("unchecked")
    public <R, RID> @NotNull UnionView<R, RID> union(@NotNull N node, String name) {
        Objects.requireNonNull(node, "Node cannot be null");
        RelationBinding<N> binding = require(name);
        if (!binding.isUnion()) {
            throw new IllegalArgumentException("Relation '" + name + "' on " + model.tableName() + " is " + binding.kind() + ", not a union");
        }
        return (UnionView<R, RID>) binding.accessor().fetch(node);
    }

    /**
     * Evaluates a join-table accessor ({@code friends_out}, {@code friends_in}) so links can be added.
     *
     * @throws IllegalArgumentException if the relation is not backed by a join table
     */
    @SuppressWarnings("unchecked")
    public @NotNull LinkedRecordSet<N, ID> links(@NotNull N node, String name) {
        RecordSet<?, ?> set = relation(node, name);
        if (!(set instanceof LinkedRecordSet<?, ?> linked)) {
            throw new IllegalArgumentException("Relation '" + name + "' on " + model.tableName() + " is not backed by a join table");
        }
        return (LinkedRecordSet<N, ID>) linked;
    }

    public boolean hasRelation(String name) {
        return bindings.containsKey(name);
    }

    public Set<String> relationNames() {
        return bindings.keySet();
    }

    @Nullable
    public RelationBinding<N> binding(String name) {
        return bindings.get(name);
    }

    private RelationBinding<N> require(String name) {
        RelationBinding<N> binding = bindings.get(name);
        if (binding == null) {
            throw new IllegalArgumentException("No relation '" + name + "' declared on " + model.tableName());
        }
        return binding;
    }

    @Override
    public String toString() {
        return "NodeType{" + model.name() + ", relations=" + bindings.keySet() + "}";
    }

    public static final class Builder<N, ID> {
        private final EntityModel<N, ID> model;
        private final NetworkRelationBuilder<N, ID> relations;
        private final Map<String, RelationBinding<N>> bindings = new LinkedHashMap<>();
        private boolean built;

        private Builder(EntityModel<N, ID> model, RelationStore store, EntityRegistry registry) {
            this.model = Objects.requireNonNull(model, "Node model cannot be null");
            this.relations = new NetworkRelationBuilder<>(model, store, registry);
        }

        /**
         * Declares a network and binds {@code <name>}, {@code <name>_out}, {@code <name>_in}
         * and, with an edge entity, {@code <through>}, {@code <through>_out}, {@code <through>_in}.
         *
         * @throws NetworkConfigurationException if the configuration cannot be resolved
         */
        public Builder<N, ID> declareNetwork(String name, @NotNull RelationConfig config) {
            checkOpen();
            ResolvedNetwork network = relations.resolve(name, config);
            registerAll(relations.bindings(network, bindings::get));
            return this;
        }

        /**
         * Declares {@code name} as the union of other accessors of this type. Sources are
         * checked when the type is built.
         */
        public Builder<N, ID> declareUnion(String name, String... sourceNames) {
            checkOpen();
            List<String> sources = sourceNames == null ? List.of() : Arrays.asList(sourceNames);
            registerAll(List.of(UnionRegistrar.union(name, sources, bindings::get)));
            return this;
        }

        /**
         * Declares a plain has-many relation, e.g. {@code Channel.premium_shows}.
         */
        public <E, EID> Builder<N, ID> declareOneToMany(
            String name,
            @NotNull EntityModel<E, EID> target,
            String foreignKey,
            @Nullable RelationFilter filter
        ) {
            checkOpen();
            Objects.requireNonNull(target, "Target model cannot be null");
            NetworkRelationBuilder.requireIdentifier(name, "relation name", name);
            NetworkRelationBuilder.requireIdentifier(name, "foreign key", foreignKey);
            if (!target.hasColumn(foreignKey)) {
                throw new NetworkConfigurationException(name, target.name() + " has no column '" + foreignKey + "'");
            }
            NetworkRelationBuilder.requireColumns(name, target, filter);
            registerAll(List.of(relations.oneToMany(name, target, foreignKey, filter)));
            return this;
        }

        /**
         * Validates union sources and freezes the declarations.
         */
        public NodeType<N, ID> build() {
            checkOpen();
            UnionRegistrar.validate(bindings);
            built = true;
            return new NodeType<>(model, bindings);
        }

        private void registerAll(List<RelationBinding<N>> declared) {
            Map<String, RelationBinding<N>> pending = new LinkedHashMap<>();
            for (RelationBinding<N> binding : declared) {
                if (!Identifiers.isIdentifier(binding.name())) {
                    throw new NetworkConfigurationException(binding.name(), "accessor name is not a valid identifier");
                }
                RelationBinding<N> existing = bindings.get(binding.name());
                if (existing == null) existing = pending.putIfAbsent(binding.name(), binding);
                if (existing != null && !existing.definition().equals(binding.definition())) {
                    throw new NetworkConfigurationException(binding.name(),
                        "already declared on " + model.tableName() + " as " + existing.definition());
                }
            }

            for (RelationBinding<N> binding : declared) {
                if (bindings.containsKey(binding.name())) {
                    Logging.deepInfo(() -> "Keeping existing binding " + model.tableName() + "." + binding.name());
                    continue;
                }
                bindings.put(binding.name(), binding);
            }
        }

        private void checkOpen() {
            if (built) {
                throw new IllegalStateException("Node type " + model.name() + " has already been built");
            }
        }
    }
}

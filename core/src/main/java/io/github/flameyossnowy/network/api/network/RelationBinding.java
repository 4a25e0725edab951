package io.github.flameyossnowy.network.api.network;

import io.github.flameyossnowy.network.api.meta.RelationKind;
import io.github.flameyossnowy.network.api.store.RelationAccessor;

import java.util.List;

/**
 * A named accessor bound onto a node type.
 *
 * @param name       accessor name, e.g. {@code friends_out}
 * @param kind       how the accessor resolves
 * @param definition canonical description; two bindings with equal definitions are interchangeable
 * @param accessor   evaluates the relation for one node
 * @param sources    accessor names a union merges, empty for other kinds
 */
public record RelationBinding<N>(
    String name,
    RelationKind kind,
    String definition,
    RelationAccessor<N, ?, ?> accessor,
    List<String> sources
) {
    public RelationBinding {
        sources = List.copyOf(sources);
    }

    public boolean isUnion() {
        return kind == RelationKind.UNION;
    }
}

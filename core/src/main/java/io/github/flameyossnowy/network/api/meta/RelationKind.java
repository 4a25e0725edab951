package io.github.flameyossnowy.network.api.meta;

public enum RelationKind {
    MANY_TO_MANY,
    ONE_TO_MANY,
    THROUGH,
    UNION
}

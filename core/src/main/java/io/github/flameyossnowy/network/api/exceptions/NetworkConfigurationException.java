package io.github.flameyossnowy.network.api.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown while a node type is being declared when a relation cannot be built
 * from its configuration. Never raised lazily on first use.
 */
public class NetworkConfigurationException extends RuntimeException {
    private final String relationName;

    public NetworkConfigurationException(@Nullable String relationName, String message) {
        super(relationName == null ? message : "Relation '" + relationName + "': " + message);
        this.relationName = relationName;
    }

    public NetworkConfigurationException(@Nullable String relationName, String message, Throwable cause) {
        super(relationName == null ? message : "Relation '" + relationName + "': " + message, cause);
        this.relationName = relationName;
    }

    public @Nullable String getRelationName() {
        return relationName;
    }
}

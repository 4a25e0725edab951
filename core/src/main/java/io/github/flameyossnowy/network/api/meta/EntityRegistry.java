package io.github.flameyossnowy.network.api.meta;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of entity models, looked up by table name or entity name.
 * <p>
 * Relation configurations name their edge entity ({@code through("invites")});
 * this is where that name is resolved.
 */
public final class EntityRegistry {
    private final Map<String, EntityModel<?, ?>> byTableName = new ConcurrentHashMap<>();
    private final Map<String, EntityModel<?, ?>> byEntityName = new ConcurrentHashMap<>();

    public EntityRegistry add(EntityModel<?, ?> model) {
        if (model == null) {
            throw new IllegalArgumentException("EntityModel cannot be null");
        }
        byTableName.put(model.tableName(), model);
        byEntityName.put(model.name(), model);
        return this;
    }

    /**
     * Resolves by table name first, then by entity name.
     *
     * @return the model, or null if nothing is registered under that name
     */
    @Nullable
    public EntityModel<?, ?> get(String name) {
        if (name == null) return null;
        EntityModel<?, ?> model = byTableName.get(name);
        return model != null ? model : byEntityName.get(name);
    }

    public boolean has(String name) {
        return get(name) != null;
    }
}

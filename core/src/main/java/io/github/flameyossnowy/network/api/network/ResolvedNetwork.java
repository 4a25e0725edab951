package io.github.flameyossnowy.network.api.network;

import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link RelationConfig} after defaulting and validation.
 *
 * @param name                  network name
 * @param throughName           accessor prefix of the edge entity, null in join-table mode
 * @param through               edge entity model, null in join-table mode
 * @param joinTable             join table, null in through mode
 * @param foreignKey            origin key column
 * @param associationForeignKey target key column
 * @param filter                optional filter
 */
public record ResolvedNetwork(
    String name,
    @Nullable String throughName,
    @Nullable EntityModel<?, ?> through,
    @Nullable String joinTable,
    String foreignKey,
    String associationForeignKey,
    @Nullable RelationFilter filter
) {
    public boolean isThrough() {
        return through != null;
    }

    public String outName() {
        return name + "_out";
    }

    public String inName() {
        return name + "_in";
    }
}

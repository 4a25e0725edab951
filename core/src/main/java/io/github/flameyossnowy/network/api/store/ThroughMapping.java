package io.github.flameyossnowy.network.api.store;

import io.github.flameyossnowy.network.api.meta.EntityModel;

/**
 * Edge entity of a self-referential has-many-through relation.
 *
 * @param edge      model of the edge entity
 * @param localKey  edge column holding the owner's id
 * @param sourceKey edge column holding the id of the node on the far side
 */
public record ThroughMapping<E, EID>(EntityModel<E, EID> edge, String localKey, String sourceKey) {
    public ThroughMapping<E, EID> inverse() {
        return new ThroughMapping<>(edge, sourceKey, localKey);
    }
}

package io.github.flameyossnowy.network.memory;

import io.github.flameyossnowy.network.api.LinkedRecordSet;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import io.github.flameyossnowy.network.api.store.JoinTableMapping;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

final class InMemoryLinkedRecordSet<T, ID> extends InMemoryRecordSet<T, ID> implements LinkedRecordSet<T, ID> {
    private final InMemoryRecordStore store;
    private final JoinTableMapping mapping;
    private final ID ownerId;

    InMemoryLinkedRecordSet(
        InMemoryRecordStore store,
        EntityModel<T, ID> model,
        JoinTableMapping mapping,
        ID ownerId,
        Supplier<List<T>> query
    ) {
        super(model, query);
        this.store = store;
        this.mapping = mapping;
        this.ownerId = ownerId;
    }

    @Override
    public void link(T other) {
        Objects.requireNonNull(other, "Linked record cannot be null");
        store.link(mapping, ownerId, model.getPrimaryKeyValue(other));
    }

    @Override
    public boolean unlink(T other) {
        Objects.requireNonNull(other, "Unlinked record cannot be null");
        return store.unlink(mapping, ownerId, model.getPrimaryKeyValue(other));
    }
}

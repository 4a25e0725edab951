package io.github.flameyossnowy.network.memory;

import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.meta.EntityModel;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A live query over an {@link InMemoryRecordStore}: every call re-runs the query.
 */
class InMemoryRecordSet<T, ID> implements RecordSet<T, ID> {
    protected final EntityModel<T, ID> model;
    private final Supplier<List<T>> query;

    InMemoryRecordSet(EntityModel<T, ID> model, Supplier<List<T>> query) {
        this.model = model;
        this.query = query;
    }

    @Override
    public int size() {
        return query.get().size();
    }

    @Override
    public boolean isEmpty() {
        return query.get().isEmpty();
    }

    @Override
    public @NotNull Iterator<T> iterator() {
        return query.get().iterator();
    }

    @Override
    public List<T> whereIdIn(Collection<? extends ID> ids) {
        Set<ID> wanted = new HashSet<>(ids);
        List<T> matches = new ArrayList<>();
        for (T record : query.get()) {
            if (wanted.contains(model.getPrimaryKeyValue(record))) matches.add(record);
        }
        return matches;
    }

    @Override
    public ID idOf(T record) {
        return model.getPrimaryKeyValue(record);
    }

    @Override
    public String toString() {
        return model.tableName() + query.get();
    }
}

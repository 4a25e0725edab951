package io.github.flameyossnowy.network.api;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * {@link RecordSet} view over a caller-owned collection. Reflects later changes to it.
 */
final class CollectionRecordSet<T, ID> implements RecordSet<T, ID> {
    private final Collection<? extends T> records;
    private final Function<? super T, ? extends ID> idExtractor;

    CollectionRecordSet(Collection<? extends T> records, Function<? super T, ? extends ID> idExtractor) {
        this.records = Objects.requireNonNull(records, "Records cannot be null");
        this.idExtractor = Objects.requireNonNull(idExtractor, "Id extractor cannot be null");
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public @NotNull Iterator<T> iterator() {
        return Collections.<T>unmodifiableCollection(records).iterator();
    }

    @Override
    public List<T> whereIdIn(Collection<? extends ID> ids) {
        Set<ID> wanted = new HashSet<>(ids);
        List<T> matches = new ArrayList<>();
        for (T record : records) {
            if (wanted.contains(idExtractor.apply(record))) matches.add(record);
        }
        return matches;
    }

    @Override
    public ID idOf(T record) {
        return idExtractor.apply(record);
    }

    @Override
    public String toString() {
        return "RecordSet" + records;
    }
}

package io.github.flameyossnowy.network.api;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A queryable collection of records as handed out by a store or a relation accessor.
 * <p>
 * Implementations are expected to be live: every call may go back to the store.
 *
 * @param <T>  the record type
 * @param <ID> the primary key type
 */
public interface RecordSet<T, ID> extends Iterable<T> {
    int size();

    boolean isEmpty();

    @Override
    @NotNull
    Iterator<T> iterator();

    /**
     * Records of this set whose primary key is one of {@code ids}. Missing ids are
     * silently skipped; callers that need all-or-nothing semantics check the result.
     */
    List<T> whereIdIn(Collection<? extends ID> ids);

    /**
     * Stable primary key of a record of this set, used for equality and deduplication.
     */
    ID idOf(T record);

    default List<T> toList() {
        List<T> out = new ArrayList<>();
        for (T record : this) out.add(record);
        return out;
    }

    default Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Membership by primary key.
     */
    default boolean includes(T record) {
        if (record == null) return false;
        ID id = idOf(record);
        return id != null && !whereIdIn(Collections.singletonList(id)).isEmpty();
    }

    /**
     * Wraps a plain collection so it can take part in unions.
     */
    static <T, ID> @NotNull RecordSet<T, ID> of(
        @NotNull Collection<? extends T> records,
        @NotNull Function<? super T, ? extends ID> idExtractor
    ) {
        return new CollectionRecordSet<>(records, idExtractor);
    }
}

package io.github.flameyossnowy.network.api.union;

import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.network.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deduplicating view over several record sets, presented as one set.
 * <p>
 * Members are identified by primary key; when two sources hold the same id the record
 * of the earlier source wins. Null sources are dropped at construction.
 * <p>
 * Two kinds of operations are kept apart:
 * <ul>
 *   <li>id lookups ({@link #find(Object)}, {@link #findAll(Collection)}, {@link #whereIdIn(Collection)})
 *   ask each non-empty source for the requested ids only and never load the union;</li>
 *   <li>full-collection operations (size, iteration, {@link #map}, {@link #filter}, {@link #toList})
 *   load every source once, deduplicate, and keep the result for the lifetime of this instance.</li>
 * </ul>
 * Instances are cheap and meant to be created per call; they are not thread-safe.
 *
 * <pre>{@code
 * UnionView<Show, Long> shows = new UnionView<>(discovery.shows(), usa.shows(), amc.shows());
 * Show show = shows.find(30L);
 * List<Show> some = shows.find(1L, 2L, 3L);
 * }</pre>
 *
 * @param <T>  the record type
 * @param <ID> the primary key type
 */
public class UnionView<T, ID> implements RecordSet<T, ID> {
    private final List<RecordSet<? extends T, ID>> sources;

    private Map<ID, T> loaded;
    private List<T> records;

    @SafeVarargs
    public UnionView(@Nullable RecordSet<? extends T, ID>... sources) {
        this(sources == null ? Collections.emptyList() : Arrays.asList(sources));
    }

    public UnionView(@Nullable Collection<? extends RecordSet<? extends T, ID>> sources) {
        List<RecordSet<? extends T, ID>> kept = new ArrayList<>();
        if (sources != null) {
            for (RecordSet<? extends T, ID> source : sources) {
                if (source != null) kept.add(source);
            }
        }
        this.sources = Collections.unmodifiableList(kept);
    }

    /**
     * The non-null sources, in priority order.
     */
    public List<RecordSet<? extends T, ID>> sources() {
        return sources;
    }

    /**
     * Looks up a single record by primary key.
     *
     * @throws RecordNotFoundException if no source holds the id
     */
    public T find(@NotNull ID id) {
        Objects.requireNonNull(id, "Id cannot be null");
        return findAll(Collections.singletonList(id)).get(0);
    }

    /**
     * Looks up several records by primary key. Duplicate ids collapse to one record.
     *
     * @throws RecordNotFoundException unless every distinct id is found
     */
    @SafeVarargs
    public final List<T> find(ID... ids) {
        return findAll(Arrays.asList(ids));
    }

    /**
     * All-or-nothing lookup: the result holds one record per distinct requested id, in
     * source order, or a {@link RecordNotFoundException} carrying the requested ids is thrown.
     */
    public List<T> findAll(@NotNull Collection<? extends ID> ids) {
        Objects.requireNonNull(ids, "Ids cannot be null");
        for (ID id : ids) Objects.requireNonNull(id, "Id cannot be null");
        Set<ID> distinct = new LinkedHashSet<>(ids);
        Map<ID, T> found = lookup(distinct);
        if (found.size() != distinct.size()) {
            throw new RecordNotFoundException(ids);
        }
        return new ArrayList<>(found.values());
    }

    /**
     * Lenient lookup, used when this view is itself a source of another union.
     */
    @Override
    public List<T> whereIdIn(Collection<? extends ID> ids) {
        return new ArrayList<>(lookup(new LinkedHashSet<>(ids)).values());
    }

    private Map<ID, T> lookup(Set<ID> ids) {
        Map<ID, T> found = new LinkedHashMap<>();
        if (ids.isEmpty()) return found;

        List<ID> requested = new ArrayList<>(ids);
        for (RecordSet<? extends T, ID> source : sources) {
            if (!source.isEmpty()) {
                collectMatches(source, requested, ids, found);
            }
        }
        return found;
    }

    private <S extends T> void collectMatches(RecordSet<S, ID> source, List<ID> requested, Set<ID> wanted, Map<ID, T> into) {
        for (S record : source.whereIdIn(requested)) {
            ID id = source.idOf(record);
            if (wanted.contains(id)) into.putIfAbsent(id, record);
        }
    }

    private Map<ID, T> load() {
        if (loaded != null) return loaded;

        Map<ID, T> into = new LinkedHashMap<>();
        for (RecordSet<? extends T, ID> source : sources) {
            collectAll(source, into);
        }
        Logging.deepInfo(() -> "Loaded union of " + sources.size() + " sources into " + into.size() + " records");

        this.records = Collections.unmodifiableList(new ArrayList<>(into.values()));
        return this.loaded = into;
    }

    private <S extends T> void collectAll(RecordSet<S, ID> source, Map<ID, T> into) {
        for (S record : source) {
            into.putIfAbsent(source.idOf(record), record);
        }
    }

    /**
     * Whether a full-collection operation has loaded this view yet.
     */
    public boolean isLoaded() {
        return loaded != null;
    }

    @Override
    public int size() {
        return load().size();
    }

    @Override
    public boolean isEmpty() {
        if (loaded != null) return loaded.isEmpty();
        for (RecordSet<? extends T, ID> source : sources) {
            if (!source.isEmpty()) return false;
        }
        return true;
    }

    @Override
    public @NotNull Iterator<T> iterator() {
        load();
        return records.iterator();
    }

    @Override
    public List<T> toList() {
        load();
        return records;
    }

    @Override
    public Stream<T> stream() {
        load();
        return records.stream();
    }

    public <R> List<R> map(@NotNull Function<? super T, ? extends R> mapper) {
        load();
        List<R> out = new ArrayList<>(records.size());
        for (T record : records) out.add(mapper.apply(record));
        return out;
    }

    public List<T> filter(@NotNull Predicate<? super T> predicate) {
        load();
        List<T> out = new ArrayList<>();
        for (T record : records) {
            if (predicate.test(record)) out.add(record);
        }
        return out;
    }

    @Override
    public boolean includes(T record) {
        if (record == null) return false;
        Map<ID, T> members = load();
        return !members.isEmpty() && members.containsKey(idOf(record));
    }

    /**
     * Key of a member record, as reported by the first source that can hold records.
     * Sources of one union are expected to share a primary key space.
     *
     * @throws IllegalStateException if no source, however nested, can hold records
     */
    @Override
    public ID idOf(T record) {
        RecordSet<T, ID> keys = keySource();
        if (keys == null) {
            throw new IllegalStateException("A union without sources holds no records");
        }
        return keys.idOf(record);
    }

    @SuppressWarnings("unchecked")
    private @Nullable RecordSet<T, ID> keySource() {
        for (RecordSet<? extends T, ID> source : sources) {
            if (source instanceof UnionView<?, ?> union && union.keySource() == null) continue;
            return (RecordSet<T, ID>) source;
        }
        return null;
    }

    @Override
    public String toString() {
        return loaded == null
            ? "UnionView{sources=" + sources.size() + ", not loaded}"
            : "UnionView" + records;
    }
}

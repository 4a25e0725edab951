package io.github.flameyossnowy.network.api.options;

import io.github.flameyossnowy.network.api.meta.EntityModel;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable conjunction of {@link FilterOption}s applied to relation rows at query time.
 *
 * <pre>{@code
 * RelationFilter accepted = RelationFilter.where("is_accepted").eq(true);
 * RelationFilter recent = RelationFilter.where("is_accepted").eq(true)
 *     .and("created_at").gte(cutoff);
 * }</pre>
 */
public final class RelationFilter {
    private final List<FilterOption> options;

    private RelationFilter(List<FilterOption> options) {
        this.options = options;
    }

    /**
     * Begins a filter on the given column.
     */
    @Contract("_ -> new")
    public static @NotNull FilterField where(String column) {
        return new FilterField(new RelationFilter(List.of()), column);
    }

    /**
     * Adds another condition on the given column.
     */
    @Contract("_ -> new")
    public @NotNull FilterField and(String column) {
        return new FilterField(this, column);
    }

    RelationFilter with(FilterOption option) {
        List<FilterOption> next = new ArrayList<>(options.size() + 1);
        next.addAll(options);
        next.add(option);
        return new RelationFilter(Collections.unmodifiableList(next));
    }

    public List<FilterOption> options() {
        return options;
    }

    public Set<String> columns() {
        Set<String> columns = new LinkedHashSet<>();
        for (FilterOption option : options) columns.add(option.column());
        return columns;
    }

    /**
     * Evaluates every condition against a record described by {@code model}.
     */
    public <T> boolean test(@NotNull EntityModel<T, ?> model, @NotNull T record) {
        for (FilterOption option : options) {
            if (!option.test(model.getValue(record, option.column()))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RelationFilter that && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        for (FilterOption option : options) {
            if (!out.isEmpty()) out.append(" AND ");
            out.append(option.column()).append(' ').append(option.operator());
            if (!option.isUnary()) out.append(' ').append(option.value());
        }
        return out.toString();
    }
}

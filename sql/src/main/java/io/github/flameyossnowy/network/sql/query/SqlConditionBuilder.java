package io.github.flameyossnowy.network.sql.query;

import io.github.flameyossnowy.network.api.options.FilterOption;
import io.github.flameyossnowy.network.api.options.RelationFilter;
import io.github.flameyossnowy.network.api.utils.Identifiers;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Renders a {@link RelationFilter} as {@code AND alias.column op ?} clauses.
 */
public final class SqlConditionBuilder {
    private static final Set<String> OPERATORS = Set.of(
        FilterOption.EQ, FilterOption.NE, FilterOption.GT, FilterOption.GTE,
        FilterOption.LT, FilterOption.LTE, FilterOption.IS_NULL, FilterOption.IS_NOT_NULL
    );

    private SqlConditionBuilder() {
        throw new AssertionError("No instances");
    }

    public static void append(StringBuilder sql, List<Object> parameters, String alias, @Nullable RelationFilter filter) {
        if (filter == null) return;
        for (FilterOption option : filter.options()) {
            if (!Identifiers.isIdentifier(option.column())) {
                throw new IllegalArgumentException("Invalid filter column: " + option.column());
            }
            if (!OPERATORS.contains(option.operator())) {
                throw new UnsupportedOperationException("Unsupported operator: " + option.operator());
            }

            if (!option.isUnary() && option.value() == null) {
                // a comparison against NULL is never true
                sql.append(" AND 1 = 0");
                continue;
            }

            sql.append(" AND ").append(alias).append('.').append(option.column());
            if (option.isUnary()) {
                sql.append(' ').append(option.operator());
                continue;
            }
            sql.append(' ').append(FilterOption.NE.equals(option.operator()) ? "<>" : option.operator()).append(" ?");
            parameters.add(option.value());
        }
    }
}

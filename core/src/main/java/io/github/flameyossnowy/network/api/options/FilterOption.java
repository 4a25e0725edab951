package io.github.flameyossnowy.network.api.options;

import io.github.flameyossnowy.network.api.utils.Values;
import org.jetbrains.annotations.Nullable;

/**
 * A single {@code column operator value} condition.
 */
public record FilterOption(String column, String operator, @Nullable Object value) {
    public static final String EQ = "=";
    public static final String NE = "!=";
    public static final String GT = ">";
    public static final String GTE = ">=";
    public static final String LT = "<";
    public static final String LTE = "<=";
    public static final String IS_NULL = "IS NULL";
    public static final String IS_NOT_NULL = "IS NOT NULL";

    /**
     * Whether the operator takes no bound value.
     */
    public boolean isUnary() {
        return IS_NULL.equals(operator) || IS_NOT_NULL.equals(operator);
    }

    /**
     * Evaluates this condition against a column value read from a record.
     * Null never satisfies a binary comparison, as in SQL.
     */
    public boolean test(@Nullable Object actual) {
        return switch (operator) {
            case IS_NULL -> actual == null;
            case IS_NOT_NULL -> actual != null;
            case EQ -> actual != null && Values.same(actual, value);
            case NE -> actual != null && value != null && !Values.same(actual, value);
            case GT -> actual != null && value != null && Values.compare(actual, value) > 0;
            case GTE -> actual != null && value != null && Values.compare(actual, value) >= 0;
            case LT -> actual != null && value != null && Values.compare(actual, value) < 0;
            case LTE -> actual != null && value != null && Values.compare(actual, value) <= 0;
            default -> throw new IllegalStateException("Unsupported operator: " + operator);
        };
    }
}

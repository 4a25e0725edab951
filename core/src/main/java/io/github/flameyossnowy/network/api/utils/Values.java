package io.github.flameyossnowy.network.api.utils;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Loose value comparison for in-memory evaluation, so that an {@code Integer} column
 * matches a {@code Long} key the way a database would compare them.
 */
public final class Values {
    private Values() {
        throw new AssertionError("No instances");
    }

    public static boolean same(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * @throws IllegalArgumentException if the values have no natural order between them
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return comparable.compareTo(right);
        }
        throw new IllegalArgumentException("Cannot order " + left + " against " + right);
    }

    /**
     * Canonical map key for an id: integral numbers collapse to {@code Long}.
     */
    public static @Nullable Object key(@Nullable Object value) {
        if (value instanceof Number number && isIntegral(number)) {
            return number.longValue();
        }
        return value;
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString()));
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }
}

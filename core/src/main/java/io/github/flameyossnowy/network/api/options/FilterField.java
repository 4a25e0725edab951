package io.github.flameyossnowy.network.api.options;

/**
 * Column-scoped operator step of {@link RelationFilter}: {@code where("age").gte(18)}.
 */
public final class FilterField {
    private final RelationFilter filter;
    private final String column;

    FilterField(RelationFilter filter, String column) {
        this.filter = filter;
        this.column = column;
    }

    private RelationFilter add(String operator, Object value) {
        return filter.with(new FilterOption(column, operator, value));
    }

    public RelationFilter eq(Object value) { return add(FilterOption.EQ, value); }
    public RelationFilter ne(Object value) { return add(FilterOption.NE, value); }
    public RelationFilter gt(Object value) { return add(FilterOption.GT, value); }
    public RelationFilter gte(Object value) { return add(FilterOption.GTE, value); }
    public RelationFilter lt(Object value) { return add(FilterOption.LT, value); }
    public RelationFilter lte(Object value) { return add(FilterOption.LTE, value); }
    public RelationFilter isNull() { return add(FilterOption.IS_NULL, null); }
    public RelationFilter isNotNull() { return add(FilterOption.IS_NOT_NULL, null); }
}

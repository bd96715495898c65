package db.columnar.exec;

import java.util.Locale;

/**
 * One requested aggregate: a function applied to a source column.
 * {@code column} may be null only for COUNT, which counts rows.
 */
public record AggregateCall(AggregateFunction function, String column) {

    public AggregateCall {
        if (column == null && function != AggregateFunction.COUNT) {
            throw new IllegalArgumentException(function + " requires a source column");
        }
    }

    public static AggregateCall count() { return new AggregateCall(AggregateFunction.COUNT, null); }
    public static AggregateCall count(String column) { return new AggregateCall(AggregateFunction.COUNT, column); }
    public static AggregateCall sum(String column) { return new AggregateCall(AggregateFunction.SUM, column); }
    public static AggregateCall min(String column) { return new AggregateCall(AggregateFunction.MIN, column); }
    public static AggregateCall max(String column) { return new AggregateCall(AggregateFunction.MAX, column); }
    public static AggregateCall avg(String column) { return new AggregateCall(AggregateFunction.AVG, column); }

    /** Output column name, e.g. {@code sum_amount}; plain {@code count} for COUNT(*). */
    public String outputName() {
        String fn = function.name().toLowerCase(Locale.ROOT);
        return column == null ? fn : fn + "_" + column;
    }
}

package db.columnar.exec;

import db.columnar.catalog.DataType;
import db.columnar.error.TypeMismatchException;

/**
 * Available aggregate functions.
 */
public enum AggregateFunction {
    COUNT, SUM, MIN, MAX, AVG;

    /** Type of the aggregate's result for a source column of {@code source} type (null for COUNT(*)). */
    public DataType resultType(DataType source) {
        return switch (this) {
            case COUNT -> DataType.INT;
            case AVG -> {
                requireNumeric(source);
                yield DataType.FLOAT;
            }
            case SUM -> {
                requireNumeric(source);
                yield source;
            }
            case MIN, MAX -> source;
        };
    }

    private void requireNumeric(DataType source) {
        if (source == null || !source.isNumeric()) {
            throw new TypeMismatchException(this + " requires a numeric column but got " + source);
        }
    }
}

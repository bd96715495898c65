package db.columnar.catalog;

import db.columnar.error.TypeMismatchException;
import db.columnar.storage.BooleanColumn;
import db.columnar.storage.Column;
import db.columnar.storage.FloatColumn;
import db.columnar.storage.IntColumn;
import db.columnar.storage.VarcharColumn;

/**
 * Supported column data types. Each constant carries the operations the
 * operators dispatch through (normalisation, ordering, vector allocation),
 * so operator code never inspects runtime classes.
 *
 * Canonical Java values: INT -> Long, FLOAT -> Double, VARCHAR -> String, BOOLEAN -> Boolean.
 */
public enum DataType {
    INT {
        @Override
        public Object normalize(Object value) {
            if (value == null || value instanceof Long) return value;
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            throw TypeMismatchException.forValue(this, value);
        }

        @Override
        int compareCanonical(Object a, Object b) { return Long.compare((Long) a, (Long) b); }

        @Override
        public Column newColumn() { return new IntColumn(); }
    },
    FLOAT {
        @Override
        public Object normalize(Object value) {
            if (value == null || value instanceof Double) return value;
            if (value instanceof Float f) return f.doubleValue();
            throw TypeMismatchException.forValue(this, value);
        }

        @Override
        int compareCanonical(Object a, Object b) { return Double.compare((Double) a, (Double) b); }

        @Override
        public Column newColumn() { return new FloatColumn(); }
    },
    VARCHAR {
        @Override
        public Object normalize(Object value) {
            if (value == null || value instanceof String) return value;
            throw TypeMismatchException.forValue(this, value);
        }

        @Override
        int compareCanonical(Object a, Object b) { return ((String) a).compareTo((String) b); }

        @Override
        public Column newColumn() { return new VarcharColumn(); }
    },
    BOOLEAN {
        @Override
        public Object normalize(Object value) {
            if (value == null || value instanceof Boolean) return value;
            throw TypeMismatchException.forValue(this, value);
        }

        @Override
        int compareCanonical(Object a, Object b) { return Boolean.compare((Boolean) a, (Boolean) b); }

        @Override
        public Column newColumn() { return new BooleanColumn(); }
    };

    /**
     * Returns the canonical boxed form of {@code value} for this type; {@code null} (absent) passes through.
     * @throws TypeMismatchException if the value belongs to another type
     */
    public abstract Object normalize(Object value);

    abstract int compareCanonical(Object a, Object b);

    /** Allocates an empty vector holding values of this type. */
    public abstract Column newColumn();

    /**
     * Total order over present values of this type. Consistent with {@code equals}
     * of the canonical values, so the same keys work for sorting and hashing.
     */
    public int compare(Object a, Object b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Absent values have no order");
        }
        return compareCanonical(normalize(a), normalize(b));
    }

    /** Like {@link #compare} but accepts absent values, ordering them after every present value. */
    public int compareAbsentLast(Object a, Object b) {
        if (a == null || b == null) {
            if (a == b) return 0;
            return a == null ? 1 : -1;
        }
        return compare(a, b);
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}

package db.columnar.storage;

import java.util.Arrays;

import db.columnar.catalog.DataType;

/**
 * 64-bit integer vector.
 */
public final class IntColumn extends Column {
    private long[] values = new long[0];

    @Override
    public DataType type() { return DataType.INT; }

    @Override
    public Object get(int row) { return getLong(row); }

    @Override
    public Long getLong(int row) {
        checkIndex(row);
        return present.get(row) ? values[row] : null;
    }

    @Override
    protected void store(int row, Object canonical) { values[row] = (Long) canonical; }

    @Override
    protected void ensureCapacity(int capacity) {
        if (capacity > values.length) values = Arrays.copyOf(values, grow(values.length, capacity));
    }

    @Override
    protected Column newEmpty() { return new IntColumn(); }
}

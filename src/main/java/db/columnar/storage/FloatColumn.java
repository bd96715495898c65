package db.columnar.storage;

import java.util.Arrays;

import db.columnar.catalog.DataType;

/**
 * Double precision floating point vector.
 */
public final class FloatColumn extends Column {
    private double[] values = new double[0];

    @Override
    public DataType type() { return DataType.FLOAT; }

    @Override
    public Object get(int row) { return getDouble(row); }

    @Override
    public Double getDouble(int row) {
        checkIndex(row);
        return present.get(row) ? values[row] : null;
    }

    @Override
    protected void store(int row, Object canonical) { values[row] = (Double) canonical; }

    @Override
    protected void ensureCapacity(int capacity) {
        if (capacity > values.length) values = Arrays.copyOf(values, grow(values.length, capacity));
    }

    @Override
    protected Column newEmpty() { return new FloatColumn(); }
}

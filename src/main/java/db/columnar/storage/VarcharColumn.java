package db.columnar.storage;

import java.util.Arrays;

import db.columnar.catalog.DataType;

public final class VarcharColumn extends Column {
    private String[] values = new String[0];

    @Override
    public DataType type() { return DataType.VARCHAR; }

    @Override
    public Object get(int row) { return getString(row); }

    @Override
    public String getString(int row) {
        checkIndex(row);
        return present.get(row) ? values[row] : null;
    }

    @Override
    protected void store(int row, Object canonical) { values[row] = (String) canonical; }

    @Override
    void set(int row, Object value) {
        super.set(row, value);
        if (value == null) values[row] = null; // drop the reference
    }

    @Override
    protected void ensureCapacity(int capacity) {
        if (capacity > values.length) values = Arrays.copyOf(values, grow(values.length, capacity));
    }

    @Override
    protected Column newEmpty() { return new VarcharColumn(); }
}

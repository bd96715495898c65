package db.columnar.storage;

import java.util.BitSet;

import db.columnar.catalog.DataType;

/**
 * Boolean vector backed by a bitmap; capacity grows implicitly with the BitSet.
 */
public final class BooleanColumn extends Column {
    private final BitSet values = new BitSet();

    @Override
    public DataType type() { return DataType.BOOLEAN; }

    @Override
    public Object get(int row) { return getBoolean(row); }

    @Override
    public Boolean getBoolean(int row) {
        checkIndex(row);
        return present.get(row) ? values.get(row) : null;
    }

    @Override
    protected void store(int row, Object canonical) { values.set(row, (Boolean) canonical); }

    @Override
    protected void ensureCapacity(int capacity) {}

    @Override
    protected Column newEmpty() { return new BooleanColumn(); }
}

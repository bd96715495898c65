package db.columnar.storage;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import db.columnar.catalog.DataType;
import db.columnar.error.TypeMismatchException;

/**
 * Densely indexed vector of values of one {@link DataType} plus a presence bitmap
 * (set bit = value present). Absent slots read back as {@code null}.
 *
 * Subclasses own the typed backing array; this class owns size and presence.
 */
public abstract class Column {
    protected static final int INITIAL_CAPACITY = 16;

    protected final BitSet present = new BitSet();
    protected int size;

    public abstract DataType type();

    /** Boxed canonical value at {@code row}, or null when absent. */
    public abstract Object get(int row);

    // Stores an already-normalised, present value. Capacity is ensured by the caller.
    protected abstract void store(int row, Object canonical);

    protected abstract void ensureCapacity(int capacity);

    protected abstract Column newEmpty();

    public static Column of(DataType type, List<?> values) {
        Column c = type.newColumn();
        for (Object v : values) c.append(v);
        return c;
    }

    public static Column ofInts(Long... values) { return of(DataType.INT, Arrays.asList(values)); }

    public static Column ofFloats(Double... values) { return of(DataType.FLOAT, Arrays.asList(values)); }

    public static Column ofVarchars(String... values) { return of(DataType.VARCHAR, Arrays.asList(values)); }

    public static Column ofBooleans(Boolean... values) { return of(DataType.BOOLEAN, Arrays.asList(values)); }

    public int size() { return size; }

    public boolean isPresent(int row) {
        checkIndex(row);
        return present.get(row);
    }

    void append(Object value) {
        Object canonical = type().normalize(value);
        ensureCapacity(size + 1);
        if (canonical != null) {
            store(size, canonical);
            present.set(size);
        }
        size++;
    }

    /** Overwrites the slot at {@code row}; null marks it absent. */
    void set(int row, Object value) {
        checkIndex(row);
        Object canonical = type().normalize(value);
        if (canonical == null) {
            present.clear(row);
        } else {
            store(row, canonical);
            present.set(row);
        }
    }

    /** Copies the given rows, in the given order, into a new column of the same type. */
    public Column select(int[] rows) {
        Column out = newEmpty();
        out.ensureCapacity(rows.length);
        for (int r : rows) out.append(get(r));
        return out;
    }

    public Column copy() {
        Column out = newEmpty();
        out.ensureCapacity(size);
        for (int i = 0; i < size; i++) out.append(get(i));
        return out;
    }

    public Long getLong(int row) {
        throw readAs(DataType.INT);
    }

    public Double getDouble(int row) {
        throw readAs(DataType.FLOAT);
    }

    public String getString(int row) {
        throw readAs(DataType.VARCHAR);
    }

    public Boolean getBoolean(int row) {
        throw readAs(DataType.BOOLEAN);
    }

    private TypeMismatchException readAs(DataType requested) {
        return new TypeMismatchException("Cannot read " + type() + " column as " + requested);
    }

    protected void checkIndex(int row) {
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for column of size " + size);
        }
    }

    protected static int grow(int current, int required) {
        return Math.max(required, Math.max(INITIAL_CAPACITY, current + (current >> 1)));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type().name()).append('[');
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(", ");
            sb.append(get(i));
        }
        return sb.append(']').toString();
    }
}

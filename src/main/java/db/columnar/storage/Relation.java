package db.columnar.storage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import db.columnar.catalog.ColumnSchema;
import db.columnar.catalog.DataType;
import db.columnar.catalog.Schema;
import db.columnar.error.SchemaException;
import db.columnar.error.TypeMismatchException;

/**
 * In-memory table: an ordered set of named columns sharing one row count.
 * The column set is fixed at creation; rows are appended by import/insert and
 * overwritten in place only by updates.
 */
public class Relation {
    private final String name;
    private final LinkedHashMap<String, Column> columns;
    private final Schema schema;
    private int rowCount;

    private Relation(String name, LinkedHashMap<String, Column> columns, int rowCount) {
        this.name = name;
        this.columns = columns;
        this.rowCount = rowCount;
        List<ColumnSchema> defs = new ArrayList<>(columns.size());
        for (Map.Entry<String, Column> e : columns.entrySet()) {
            defs.add(new ColumnSchema(e.getKey(), e.getValue().type()));
        }
        this.schema = new Schema(defs);
    }

    public static Builder builder(String name) { return new Builder(name); }

    public static Relation empty(String name, Schema schema) {
        Builder b = builder(name);
        for (ColumnSchema c : schema.columns()) b.adopt(c.name(), c.type().newColumn());
        return b.build();
    }

    /**
     * Import entry point. Every row is validated before anything is stored.
     */
    public static Relation fromRows(String name, Schema schema, List<? extends List<?>> rows) {
        List<List<Object>> normalized = new ArrayList<>(rows.size());
        for (List<?> row : rows) normalized.add(normalizeRow(schema, row));
        Relation rel = empty(name, schema);
        for (List<Object> row : normalized) rel.appendNormalized(row);
        return rel;
    }

    public String name() { return name; }

    public Schema schema() { return schema; }

    public int rowCount() { return rowCount; }

    public List<String> columnNames() { return schema.names(); }

    public boolean hasColumn(String column) { return columns.containsKey(column); }

    /** Read access to a column; values change only through {@link #appendRow} and {@link #set}. */
    public Column column(String column) {
        Column c = columns.get(column);
        if (c == null) throw SchemaException.unknownColumn(name, column);
        return c;
    }

    public Object get(int row, String column) {
        return column(column).get(row);
    }

    /** Reads a value, failing if the column is not of the requested type. */
    public Object get(int row, String column, DataType expected) {
        Column c = column(column);
        if (c.type() != expected) throw TypeMismatchException.forColumn(column, expected, c.type());
        return c.get(row);
    }

    public List<Object> row(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for " + name + " (" + rowCount + " rows)");
        }
        List<Object> out = new ArrayList<>(columns.size());
        for (Column c : columns.values()) out.add(c.get(row));
        return out;
    }

    /** Appends one row in column order; validated in full before any column grows. */
    public void appendRow(List<?> values) {
        appendNormalized(normalizeRow(schema, values));
    }

    /**
     * Export entry point: one name -> value map per row, column order preserved, absent as null.
     */
    public Iterable<Map<String, Object>> iterRows() {
        return () -> new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() { return next < rowCount; }

            @Override
            public Map<String, Object> next() {
                if (!hasNext()) throw new NoSuchElementException();
                Map<String, Object> out = new LinkedHashMap<>();
                for (Map.Entry<String, Column> e : columns.entrySet()) {
                    out.put(e.getKey(), e.getValue().get(next));
                }
                next++;
                return out;
            }
        };
    }

    /**
     * Overwrites one value in place; null marks it absent. This is the write path of updates,
     * so row count and column set stay fixed.
     */
    public void set(int row, String column, Object value) {
        column(column).set(row, value);
    }

    /** New relation holding copies of the given rows in the given order. */
    public Relation select(String newName, int[] rows) {
        Builder b = builder(newName);
        for (Map.Entry<String, Column> e : columns.entrySet()) b.adopt(e.getKey(), e.getValue().select(rows));
        return b.build();
    }

    public Relation copy(String newName) {
        Builder b = builder(newName);
        for (Map.Entry<String, Column> e : columns.entrySet()) b.adopt(e.getKey(), e.getValue().copy());
        return b.build();
    }

    private void appendNormalized(List<Object> values) {
        int i = 0;
        for (Column c : columns.values()) c.append(values.get(i++));
        rowCount++;
    }

    private static List<Object> normalizeRow(Schema schema, List<?> row) {
        if (row.size() != schema.size()) {
            throw new SchemaException("Row has " + row.size() + " values but schema has " + schema.size() + " columns");
        }
        List<Object> out = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) out.add(schema.get(i).type().normalize(row.get(i)));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation other)) return false;
        if (rowCount != other.rowCount || !schema.equals(other.schema)) return false;
        for (int r = 0; r < rowCount; r++) {
            if (!row(r).equals(other.row(r))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return 31 * schema.hashCode() + rowCount;
    }

    @Override
    public String toString() {
        return "Relation[" + name + " " + schema.names() + " rows=" + rowCount + "]";
    }

    public static final class Builder {
        private final String name;
        private final LinkedHashMap<String, Column> columns = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /** Adds a copy of {@code column}; the built relation never shares storage with the caller. */
        public Builder column(String columnName, Column column) {
            return adopt(columnName, column.copy());
        }

        // Takes a column nobody else references.
        private Builder adopt(String columnName, Column column) {
            if (columns.containsKey(columnName)) throw new SchemaException("Duplicate column name: " + columnName);
            columns.put(columnName, column);
            return this;
        }

        public Relation build() {
            int rows = -1;
            for (Map.Entry<String, Column> e : columns.entrySet()) {
                int size = e.getValue().size();
                if (rows == -1) {
                    rows = size;
                } else if (size != rows) {
                    throw new SchemaException("Column '" + e.getKey() + "' has " + size + " rows, expected " + rows);
                }
            }
            return new Relation(name, columns, Math.max(rows, 0));
        }
    }
}

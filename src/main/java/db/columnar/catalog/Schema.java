package db.columnar.catalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import db.columnar.error.SchemaException;

/**
 * Ordered column definitions of a relation or an operator output. Names are unique.
 */
public record Schema(List<ColumnSchema> columns) {

    public Schema {
        Set<String> seen = new HashSet<>();
        for (ColumnSchema c : columns) {
            if (!seen.add(c.name())) throw new SchemaException("Duplicate column name: " + c.name());
        }
        columns = List.copyOf(columns);
    }

    public static Schema of(ColumnSchema... columns) {
        return new Schema(List.of(columns));
    }

    public static Builder builder() { return new Builder(); }

    public int size() { return columns.size(); }

    public ColumnSchema get(int i) { return columns.get(i); }

    /** Position of {@code name}, or -1. */
    public int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    public ColumnSchema column(String name) {
        int i = indexOf(name);
        if (i == -1) throw new SchemaException("Column not found: " + name);
        return columns.get(i);
    }

    public List<String> names() {
        List<String> out = new ArrayList<>(columns.size());
        for (ColumnSchema c : columns) out.add(c.name());
        return out;
    }

    public static final class Builder {
        private final List<ColumnSchema> columns = new ArrayList<>();

        private Builder() {}

        public Builder column(String name, DataType type) {
            columns.add(new ColumnSchema(name, type));
            return this;
        }

        public Schema build() { return new Schema(columns); }
    }
}

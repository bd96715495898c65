package db.columnar.exec;

import java.util.List;

import db.columnar.catalog.Schema;
import db.columnar.error.SchemaException;

/**
 * Row is an execution pipeline unit: values in schema order, absent as null.
 */
public class Row {
    private final List<Object> values;
    private final Schema schema;

    public static Row of(List<Object> values, Schema schema) { return new Row(values, schema); }

    public Row(List<Object> values, Schema schema) {
        if (values.size() != schema.size()) {
            throw new IllegalArgumentException("Row has " + values.size() + " values for " + schema.size() + " columns");
        }
        this.values = values;
        this.schema = schema;
    }

    public List<Object> values() { return values; }
    public Schema schema() { return schema; }

    public Object get(int i) { return values.get(i); }

    public Object get(String column) {
        int i = schema.indexOf(column);
        if (i == -1) throw new SchemaException("Column not in row: " + column);
        return values.get(i);
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}

package db.columnar.exec;

import java.util.ArrayList;
import java.util.List;

import db.columnar.catalog.ColumnSchema;
import db.columnar.catalog.Schema;
import db.columnar.error.SchemaException;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Projection operator: materialises a subset of columns for the positions its child yields.
 * Output columns may reorder, subset and rename the source columns; values are copied so the
 * result never shares storage with the source relation.
 */
public class ProjectionOperator implements Operator {

    /** One output column: the source column it copies and the name it is published under. */
    public record OutputColumn(String source, String name) {
        public static OutputColumn of(String column) { return new OutputColumn(column, column); }
        public static OutputColumn renamed(String source, String name) { return new OutputColumn(source, name); }
    }

    private final RowIdStream child;
    private final Column[] sources;
    private final Schema schema;

    public ProjectionOperator(RowIdStream child, List<OutputColumn> outputs) {
        if (outputs == null || outputs.isEmpty()) throw new SchemaException("Projection requires at least one output column");
        this.child = child;
        Relation rel = child.relation();
        this.sources = new Column[outputs.size()];
        List<ColumnSchema> defs = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            OutputColumn out = outputs.get(i);
            sources[i] = rel.column(out.source());
            defs.add(new ColumnSchema(out.name(), sources[i].type()));
        }
        this.schema = new Schema(defs); // rejects duplicate output names
    }

    /**
     * Build a ProjectionOperator keeping the named columns under their own names.
     */
    public static ProjectionOperator forColumnNames(RowIdStream child, List<String> columnNames) {
        List<OutputColumn> outputs = new ArrayList<>(columnNames.size());
        for (String name : columnNames) outputs.add(OutputColumn.of(name));
        return new ProjectionOperator(child, outputs);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        int row = child.next();
        if (row == RowIdStream.END) return null;
        List<Object> projected = new ArrayList<>(sources.length);
        for (Column c : sources) projected.add(c.get(row));
        return Row.of(projected, schema);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public Schema schema() { return schema; }

    /**
     * Drains the child and copies the projected columns column-at-a-time into a new relation.
     */
    public Relation materialize(String name) {
        int[] positions = RowIdStream.drain(child);
        Relation.Builder b = Relation.builder(name);
        for (int i = 0; i < sources.length; i++) b.column(schema.get(i).name(), sources[i].select(positions));
        return b.build();
    }
}

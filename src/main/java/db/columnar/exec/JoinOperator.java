package db.columnar.exec;

import java.util.ArrayList;
import java.util.List;

import db.columnar.catalog.ColumnSchema;
import db.columnar.catalog.Schema;
import db.columnar.error.UnsupportedPredicateException;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Base of the INNER JOIN strategies. Output rows hold the left row's values followed by
 * the right row's values. Column names present on both sides are qualified with the
 * relation name ({@code students.id}, {@code enrollments.id}), or with {@code left.} /
 * {@code right.} when both relations share a name.
 */
public abstract class JoinOperator implements Operator {
    protected final RowIdStream left;
    protected final RowIdStream right;
    protected final JoinPredicate predicate;
    private final Column[] leftColumns;
    private final Column[] rightColumns;
    private final Schema schema;

    protected JoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate) {
        this.left = left;
        this.right = right;
        this.predicate = predicate;
        Relation l = left.relation();
        Relation r = right.relation();
        this.leftColumns = columnsOf(l);
        this.rightColumns = columnsOf(r);
        this.schema = joinedSchema(l, r);
    }

    /**
     * Output schema of joining {@code left} with {@code right}.
     */
    public static Schema joinedSchema(Relation left, Relation right) {
        String leftPrefix = left.name().equals(right.name()) ? "left" : left.name();
        String rightPrefix = left.name().equals(right.name()) ? "right" : right.name();
        List<ColumnSchema> defs = new ArrayList<>(left.schema().size() + right.schema().size());
        for (ColumnSchema c : left.schema().columns()) {
            String name = right.hasColumn(c.name()) ? leftPrefix + "." + c.name() : c.name();
            defs.add(new ColumnSchema(name, c.type()));
        }
        for (ColumnSchema c : right.schema().columns()) {
            String name = left.hasColumn(c.name()) ? rightPrefix + "." + c.name() : c.name();
            defs.add(new ColumnSchema(name, c.type()));
        }
        return new Schema(defs);
    }

    private static Column[] columnsOf(Relation rel) {
        List<String> names = rel.columnNames();
        Column[] out = new Column[names.size()];
        for (int i = 0; i < out.length; i++) out[i] = rel.column(names.get(i));
        return out;
    }

    /** Builds the output row for a matched (left, right) pair. */
    protected Row combine(int leftRow, int rightRow) {
        List<Object> combined = new ArrayList<>(leftColumns.length + rightColumns.length);
        for (Column c : leftColumns) combined.add(c.get(leftRow));
        for (Column c : rightColumns) combined.add(c.get(rightRow));
        return Row.of(combined, schema);
    }

    /**
     * The equi-join key of {@code predicate}, validated against both inputs.
     * @throws UnsupportedPredicateException if the predicate is not a single equality
     */
    protected static JoinPredicate.EquiKey requireEquiKey(String strategy, JoinPredicate predicate, RowIdStream left, RowIdStream right) {
        JoinPredicate.EquiKey key = predicate.equiKey();
        if (key == null) {
            throw new UnsupportedPredicateException(strategy + " join requires a single equality key but got: " + predicate);
        }
        predicate.bind(left.relation(), right.relation()); // name and type checks
        return key;
    }

    @Override
    public Schema schema() { return schema; }
}

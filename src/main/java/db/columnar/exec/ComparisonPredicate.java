package db.columnar.exec;

import java.util.Set;
import java.util.function.IntPredicate;

import db.columnar.catalog.DataType;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Compares a single column against a literal of the column's type.
 * Supports operators: EQ, NE, LT, LTE, GT, GTE.
 * An absent column value, or a null literal, never satisfies the comparison.
 */
public class ComparisonPredicate implements Predicate {
    public enum Op {
        EQ, NE, LT, LTE, GT, GTE;

        /** Applies this operator to the sign of a {@code compare} result. */
        public boolean accepts(int cmp) {
            return switch (this) {
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
            };
        }
    }

    private final String column;
    private final Op op;
    private final Object literal;

    public ComparisonPredicate(String column, Op op, Object literal) {
        this.column = column;
        this.op = op;
        this.literal = literal;
    }

    public String column() { return column; }
    public Op op() { return op; }
    public Object literal() { return literal; }

    @Override
    public IntPredicate bind(Relation relation) {
        Column col = relation.column(column);
        DataType type = col.type();
        Object value = type.normalize(literal);
        if (value == null) return row -> false;
        return row -> {
            Object v = col.get(row);
            return v != null && op.accepts(type.compare(v, value));
        };
    }

    @Override
    public Set<String> columns() { return Set.of(column); }

    // For debugging
    @Override
    public String toString() { return column + " " + op + " " + literal; }
}

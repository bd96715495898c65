package db.columnar.exec;

import java.util.function.IntPredicate;

import db.columnar.storage.Relation;

/**
 * Operator that filters row positions from its child based on a Predicate.
 * Pulls positions until one matches or the child is exhausted; matching
 * positions pass through unchanged.
 */
public class FilterOperator implements RowIdStream {
    private final RowIdStream child;
    private final Predicate predicate;
    private final IntPredicate bound;

    public FilterOperator(RowIdStream child, Predicate predicate) {
        this.child = child;
        this.predicate = predicate;
        this.bound = predicate.bind(child.relation()); // validates names and literal types up front
    }

    public Predicate predicate() { return predicate; }

    @Override
    public void open() { child.open(); }

    @Override
    public int next() {
        int row;
        while ((row = child.next()) != END) {
            if (bound.test(row)) return row;
        }
        return END;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public Relation relation() { return child.relation(); }
}

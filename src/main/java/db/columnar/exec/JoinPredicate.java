package db.columnar.exec;

import java.util.Arrays;
import java.util.List;

import db.columnar.error.TypeMismatchException;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Match condition between a left and a right row.
 * A single {@link #equal} comparison is an equi-join key and is accepted by every join
 * strategy; any other predicate can only be evaluated by the nested-loop join.
 */
public interface JoinPredicate {

    /** Evaluates a bound join predicate for a (left, right) pair of row positions. */
    @FunctionalInterface
    interface Bound {
        boolean test(int leftRow, int rightRow);
    }

    /** Equality key of an equi-join: one column per side. */
    record EquiKey(String leftColumn, String rightColumn) {}

    /**
     * Resolves column names against both relations and checks that compared columns share a type.
     */
    Bound bind(Relation left, Relation right);

    /** The equi-join key if this predicate is a single equality comparison, otherwise null. */
    default EquiKey equiKey() { return null; }

    static JoinPredicate equal(String leftColumn, String rightColumn) {
        return new Comparison(leftColumn, ComparisonPredicate.Op.EQ, rightColumn);
    }

    static JoinPredicate compare(String leftColumn, ComparisonPredicate.Op op, String rightColumn) {
        return new Comparison(leftColumn, op, rightColumn);
    }

    static JoinPredicate and(JoinPredicate... predicates) {
        return new Compound(Arrays.asList(predicates), true);
    }

    static JoinPredicate or(JoinPredicate... predicates) {
        return new Compound(Arrays.asList(predicates), false);
    }

    /**
     * left.column OP right.column; absent on either side never matches.
     */
    final class Comparison implements JoinPredicate {
        private final String leftColumn;
        private final ComparisonPredicate.Op op;
        private final String rightColumn;

        private Comparison(String leftColumn, ComparisonPredicate.Op op, String rightColumn) {
            this.leftColumn = leftColumn;
            this.op = op;
            this.rightColumn = rightColumn;
        }

        @Override
        public Bound bind(Relation left, Relation right) {
            Column l = left.column(leftColumn);
            Column r = right.column(rightColumn);
            if (l.type() != r.type()) {
                throw new TypeMismatchException("Join columns " + left.name() + "." + leftColumn + " (" + l.type()
                        + ") and " + right.name() + "." + rightColumn + " (" + r.type() + ") differ in type");
            }
            return (lr, rr) -> {
                Object a = l.get(lr);
                Object b = r.get(rr);
                return a != null && b != null && op.accepts(l.type().compare(a, b));
            };
        }

        @Override
        public EquiKey equiKey() {
            return op == ComparisonPredicate.Op.EQ ? new EquiKey(leftColumn, rightColumn) : null;
        }

        @Override
        public String toString() { return "left." + leftColumn + " " + op + " right." + rightColumn; }
    }

    final class Compound implements JoinPredicate {
        private final List<JoinPredicate> children;
        private final boolean and;

        private Compound(List<JoinPredicate> children, boolean and) {
            if (children.size() < 2) throw new IllegalArgumentException((and ? "AND" : "OR") + " requires at least two child predicates");
            this.children = children;
            this.and = and;
        }

        @Override
        public Bound bind(Relation left, Relation right) {
            Bound[] bound = new Bound[children.size()];
            for (int i = 0; i < bound.length; i++) bound[i] = children.get(i).bind(left, right);
            return (lr, rr) -> {
                for (Bound b : bound) {
                    if (b.test(lr, rr) != and) return !and;
                }
                return and;
            };
        }

        @Override
        public String toString() { return children.toString().replace(", ", and ? " AND " : " OR "); }
    }
}

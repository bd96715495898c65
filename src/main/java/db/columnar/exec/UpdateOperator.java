package db.columnar.exec;

import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.error.SchemaException;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Overwrites column values in place for a selection of rows.
 *
 * All-or-nothing per call: the affected positions are collected first, every new value is
 * computed and type-checked into a staging area, and only then written. Any failure leaves
 * the relation unchanged. Row count and column set never change.
 */
public class UpdateOperator {
    private static final Logger log = LoggerFactory.getLogger(UpdateOperator.class);

    private final Relation target;
    private final List<Assignment> assignments;
    private final Column[] columns;
    private final IntPredicate filter; // null when rows come from a stream
    private final RowIdStream rows;

    /** Updates every row of {@code target} satisfying {@code predicate}; null predicate selects all rows. */
    public UpdateOperator(Relation target, Predicate predicate, List<Assignment> assignments) {
        this(target, predicate == null ? row -> true : predicate.bind(target), null, assignments);
    }

    /** Updates exactly the positions produced by {@code rows}, which must refer to {@code target}. */
    public UpdateOperator(Relation target, RowIdStream rows, List<Assignment> assignments) {
        this(target, null, rows, assignments);
        if (rows.relation() != target) {
            throw new SchemaException("Row stream over " + rows.relation().name() + " cannot update " + target.name());
        }
    }

    private UpdateOperator(Relation target, IntPredicate filter, RowIdStream rows, List<Assignment> assignments) {
        if (assignments.isEmpty()) throw new IllegalArgumentException("Update requires at least one assignment");
        this.target = target;
        this.filter = filter;
        this.rows = rows;
        this.assignments = List.copyOf(assignments);
        this.columns = new Column[assignments.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = target.column(assignments.get(i).column());
            // constants are checked before any row is read
            if (assignments.get(i).isConstant()) columns[i].type().normalize(assignments.get(i).valueFor(null));
        }
    }

    /**
     * Applies the assignments and returns the number of affected rows.
     */
    public int execute() {
        int[] affected = rows != null ? RowIdStream.drain(rows) : selectRows();

        // Stage: assignments apply in order, so a later assignment to the same column sees the earlier value.
        Object[][] staged = new Object[columns.length][affected.length];
        for (int i = 0; i < affected.length; i++) {
            int row = affected[i];
            for (int a = 0; a < columns.length; a++) {
                Object current = currentValue(staged, a, i, row);
                staged[a][i] = columns[a].type().normalize(assignments.get(a).valueFor(current));
            }
        }

        for (int a = 0; a < columns.length; a++) {
            String column = assignments.get(a).column();
            for (int i = 0; i < affected.length; i++) target.set(affected[i], column, staged[a][i]);
        }
        log.debug("Updated {} rows of {} ({})", affected.length, target.name(), assignments);
        return affected.length;
    }

    private Object currentValue(Object[][] staged, int assignment, int i, int row) {
        for (int prev = assignment - 1; prev >= 0; prev--) {
            if (columns[prev] == columns[assignment]) return staged[prev][i];
        }
        return columns[assignment].get(row);
    }

    private int[] selectRows() {
        int n = target.rowCount();
        int[] out = new int[n];
        int k = 0;
        for (int row = 0; row < n; row++) {
            if (filter.test(row)) out[k++] = row;
        }
        return Arrays.copyOf(out, k);
    }
}

package db.columnar.query;

import java.util.Iterator;
import java.util.NoSuchElementException;

import db.columnar.exec.Operator;
import db.columnar.exec.Row;
import db.columnar.exec.RowIdStream;
import db.columnar.storage.Relation;

/**
 * Executes a planned operator pipeline by pulling its root.
 */
public class QueryExecutor {
    /**
     * Lazily iterates the rows of {@code op}. The operator is opened by the first pull and
     * closed as soon as it reports exhaustion; each iteration needs a fresh operator.
     */
    public Iterable<Row> stream(Operator op) {
        return () -> new RowIterator(op);
    }

    /**
     * Drains {@code op} into a new relation with the operator's output schema.
     */
    public Relation materialize(Operator op, String name) {
        Relation out = Relation.empty(name, op.schema());
        for (Row row : stream(op)) out.appendRow(row.values());
        return out;
    }

    /**
     * Copies the rows selected by {@code stream}, in stream order, into a new relation.
     */
    public Relation materialize(RowIdStream stream, String name) {
        return stream.relation().select(name, rowIds(stream));
    }

    public int[] rowIds(RowIdStream stream) {
        return RowIdStream.drain(stream);
    }

    private static final class RowIterator implements Iterator<Row> {
        private final Operator op;
        private boolean started;
        private boolean done;
        private Row pending; // fetched but not yet returned

        RowIterator(Operator op) {
            this.op = op;
        }

        @Override
        public boolean hasNext() {
            if (done) return false;
            if (pending == null) {
                if (!started) {
                    op.open();
                    started = true;
                }
                pending = op.next();
                if (pending == null) {
                    done = true;
                    op.close();
                }
            }
            return pending != null;
        }

        @Override
        public Row next() {
            if (!hasNext()) throw new NoSuchElementException();
            Row row = pending;
            pending = null;
            return row;
        }
    }
}

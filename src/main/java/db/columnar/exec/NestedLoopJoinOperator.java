package db.columnar.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.storage.Relation;

/**
 * Nested loop INNER JOIN: for every left row, tests every right row against the predicate.
 * The only strategy that accepts non-equality predicates. The right input is buffered on
 * open (streams cannot be replayed); the left input is streamed. Output is left-major.
 */
public class NestedLoopJoinOperator extends JoinOperator {
    private static final Logger log = LoggerFactory.getLogger(NestedLoopJoinOperator.class);

    private final JoinPredicate.Bound bound;

    private int[] rightRows;
    private int currentLeft = RowIdStream.END;
    private int rightPos;
    private boolean opened;

    public NestedLoopJoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate) {
        super(left, right, predicate);
        this.bound = predicate.bind(left.relation(), right.relation());
    }

    public NestedLoopJoinOperator(Relation left, Relation right, JoinPredicate predicate) {
        this(new ScanOperator(left), new ScanOperator(right), predicate);
    }

    @Override
    public void open() {
        if (opened) return;
        rightRows = RowIdStream.drain(right);
        log.debug("Nested loop join buffered {} right rows of {}", rightRows.length, right.relation().name());
        left.open();
        currentLeft = rightRows.length == 0 ? RowIdStream.END : left.next();
        rightPos = 0;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) return null;
        while (currentLeft != RowIdStream.END) {
            while (rightPos < rightRows.length) {
                int r = rightRows[rightPos++];
                if (bound.test(currentLeft, r)) return combine(currentLeft, r);
            }
            currentLeft = left.next();
            rightPos = 0;
        }
        return null;
    }

    @Override
    public void close() {
        left.close();
        // right already closed after buffering
        rightRows = null;
        opened = false;
    }
}

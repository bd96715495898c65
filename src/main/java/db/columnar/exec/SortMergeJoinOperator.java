package db.columnar.exec;

import java.util.Arrays;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.catalog.DataType;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Sort-merge INNER equi-join.
 *
 * Sort phase (open): both inputs are drained, rows with an absent key dropped, and each side
 * stable-sorted by key unless already in key order. Merge phase (next): two cursors advance
 * over the sorted sides; for a run of equal keys every left row of the run is paired with
 * every right row of the run by replaying the right run once per left row.
 * Output order: key ascending, then left input order, then right input order.
 */
public class SortMergeJoinOperator extends JoinOperator {
    private static final Logger log = LoggerFactory.getLogger(SortMergeJoinOperator.class);

    private final Column leftKey;
    private final Column rightKey;
    private final DataType keyType;

    private int[] leftSorted;
    private int[] rightSorted;
    private int li;
    private int ri;
    // current run of equal keys
    private boolean inRun;
    private int leftRunEnd;
    private int rightRunStart;
    private int rightRunEnd;
    private int rj;
    private boolean opened;

    public SortMergeJoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate) {
        super(left, right, predicate);
        JoinPredicate.EquiKey key = requireEquiKey("Sort-merge", predicate, left, right);
        this.leftKey = left.relation().column(key.leftColumn());
        this.rightKey = right.relation().column(key.rightColumn());
        this.keyType = leftKey.type();
    }

    public SortMergeJoinOperator(Relation left, Relation right, JoinPredicate predicate) {
        this(new ScanOperator(left), new ScanOperator(right), predicate);
    }

    @Override
    public void open() {
        if (opened) return;
        leftSorted = sortedByKey(RowIdStream.drain(left), leftKey);
        rightSorted = sortedByKey(RowIdStream.drain(right), rightKey);
        log.debug("Sort-merge join sorted {} left and {} right rows", leftSorted.length, rightSorted.length);
        li = 0;
        ri = 0;
        inRun = false;
        opened = true;
    }

    private int[] sortedByKey(int[] rows, Column key) {
        int n = 0;
        for (int r : rows) {
            if (key.isPresent(r)) rows[n++] = r; // absent keys never match
        }
        int[] present = Arrays.copyOf(rows, n);
        Comparator<Integer> byKey = (a, b) -> keyType.compare(key.get(a), key.get(b));
        for (int i = 1; i < present.length; i++) {
            if (byKey.compare(present[i - 1], present[i]) > 0) {
                return SortOperator.sortRows(present, byKey);
            }
        }
        return present;
    }

    @Override
    public Row next() {
        if (leftSorted == null) return null;
        while (true) {
            if (inRun) {
                if (rj < rightRunEnd) return combine(leftSorted[li], rightSorted[rj++]);
                li++;
                if (li < leftRunEnd) {
                    rj = rightRunStart; // replay the right run for the next left row
                    continue;
                }
                inRun = false;
                ri = rightRunEnd;
            }
            if (li >= leftSorted.length || ri >= rightSorted.length) return null;
            Object lv = leftKey.get(leftSorted[li]);
            int c = keyType.compare(lv, rightKey.get(rightSorted[ri]));
            if (c < 0) {
                li++;
            } else if (c > 0) {
                ri++;
            } else {
                leftRunEnd = li + 1;
                while (leftRunEnd < leftSorted.length && keyType.compare(lv, leftKey.get(leftSorted[leftRunEnd])) == 0) leftRunEnd++;
                rightRunStart = ri;
                rightRunEnd = ri + 1;
                while (rightRunEnd < rightSorted.length && keyType.compare(lv, rightKey.get(rightSorted[rightRunEnd])) == 0) rightRunEnd++;
                rj = rightRunStart;
                inRun = true;
            }
        }
    }

    @Override
    public void close() {
        leftSorted = null;
        rightSorted = null;
        inRun = false;
        opened = false;
    }
}

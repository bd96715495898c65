package db.columnar.exec;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Orders the positions of its child by one or more columns.
 * Sort phase runs on open (drains the child), emit phase on next.
 * Stable: ties keep the child's order. Absent values sort last in both directions.
 */
public class SortOperator implements RowIdStream {
    private static final Logger log = LoggerFactory.getLogger(SortOperator.class);

    public enum Order { ASC, DESC }

    public record SortKey(String column, Order order) {
        public static SortKey asc(String column) { return new SortKey(column, Order.ASC); }
        public static SortKey desc(String column) { return new SortKey(column, Order.DESC); }
    }

    private final RowIdStream child;
    private final Comparator<Integer> comparator;

    private int[] sorted;
    private int pos;
    private boolean opened;

    public SortOperator(RowIdStream child, List<SortKey> keys) {
        if (keys.isEmpty()) throw new IllegalArgumentException("SortOperator requires at least one sort key");
        this.child = child;
        Comparator<Integer> cmp = null;
        for (SortKey key : keys) {
            Comparator<Integer> next = byColumn(child.relation().column(key.column()), key.order());
            cmp = cmp == null ? next : cmp.thenComparing(next);
        }
        this.comparator = cmp;
    }

    public SortOperator(RowIdStream child, String column, Order order) {
        this(child, List.of(new SortKey(column, order)));
    }

    static Comparator<Integer> byColumn(Column column, Order order) {
        return (a, b) -> {
            Object va = column.get(a);
            Object vb = column.get(b);
            if (va == null || vb == null) return column.type().compareAbsentLast(va, vb); // absent last regardless of direction
            int c = column.type().compare(va, vb);
            return order == Order.ASC ? c : -c;
        };
    }

    @Override
    public void open() {
        if (opened) return;
        sorted = sortRows(RowIdStream.drain(child), comparator);
        pos = 0;
        opened = true;
        log.debug("Sorted {} rows of {}", sorted.length, child.relation().name());
    }

    static int[] sortRows(int[] rows, Comparator<Integer> comparator) {
        Integer[] boxed = new Integer[rows.length];
        for (int i = 0; i < rows.length; i++) boxed[i] = rows[i];
        Arrays.sort(boxed, comparator); // stable for objects
        int[] out = new int[rows.length];
        for (int i = 0; i < out.length; i++) out[i] = boxed[i];
        return out;
    }

    @Override
    public int next() {
        if (!opened || pos >= sorted.length) return END;
        return sorted[pos++];
    }

    @Override
    public void close() {
        opened = false;
        sorted = null;
    }

    @Override
    public Relation relation() { return child.relation(); }
}

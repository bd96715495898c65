package db.columnar.exec;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import db.columnar.index.Index;
import db.columnar.storage.Relation;

/**
 * Leaf of every pipeline. Emits row positions of a relation either in storage order
 * (full scan) or, when given an index, only the positions the index yields for an
 * equality key or an inclusive key range.
 */
public class ScanOperator implements RowIdStream {
    private final Relation relation;
    private final Supplier<List<Integer>> indexProbe; // null => full scan

    // State
    private int limit;
    private int current;
    private Iterator<Integer> iter;
    private boolean opened;

    public ScanOperator(Relation relation) {
        this.relation = relation;
        this.indexProbe = null;
    }

    /** Equality scan through {@code index}. */
    public ScanOperator(Index index, Object key) {
        this.relation = index.relation();
        index.type().normalize(key); // fail on a mistyped key before execution
        this.indexProbe = () -> index.lookup(key);
    }

    public static ScanOperator range(Index index, Object lowInclusive, Object highInclusive) {
        index.type().normalize(lowInclusive);
        index.type().normalize(highInclusive);
        return new ScanOperator(index.relation(), () -> index.range(lowInclusive, highInclusive));
    }

    private ScanOperator(Relation relation, Supplier<List<Integer>> indexProbe) {
        this.relation = relation;
        this.indexProbe = indexProbe;
    }

    /** True when this scan emits every row of its relation. */
    public boolean isFullScan() { return indexProbe == null; }

    @Override
    public void open() {
        if (opened) return;
        if (indexProbe != null) {
            iter = indexProbe.get().iterator();
        } else {
            limit = relation.rowCount();
            current = 0;
        }
        opened = true;
    }

    @Override
    public int next() {
        if (!opened) return END;
        if (iter != null) return iter.hasNext() ? iter.next() : END;
        return current < limit ? current++ : END;
    }

    @Override
    public void close() {
        opened = false;
        iter = null;
        limit = 0;
    }

    @Override
    public Relation relation() { return relation; }
}

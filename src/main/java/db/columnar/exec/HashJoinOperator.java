package db.columnar.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.error.SchemaException;
import db.columnar.index.Index;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Hash INNER equi-join.
 *
 * Build phase (open): the build side is materialised into a multimap key -> positions,
 * or an existing {@link Index} on the build side's key column is used in its place.
 * Probe phase (next): the other side is streamed and each probe row emits one output row
 * per build-side match. Absent keys neither build nor probe. Output columns are always
 * left then right, whichever side is built. Heavy key skew degrades to large match lists.
 */
public class HashJoinOperator extends JoinOperator {
    private static final Logger log = LoggerFactory.getLogger(HashJoinOperator.class);

    /** Which input becomes the hash table. SMALLER compares the inputs' relation row counts. */
    public enum BuildSide { SMALLER, LEFT, RIGHT }

    private final boolean buildLeft;
    private final Column buildKey;
    private final Column probeKey;
    private final RowIdStream probe;
    private final RowIdStream build;
    private final Index buildIndex; // nullable

    // Materialized build side keyed by join value
    private Function<Object, List<Integer>> table;
    private int currentProbe = RowIdStream.END;
    private List<Integer> currentMatchList = Collections.emptyList();
    private int matchIndex = 0; // index within currentMatchList
    private boolean opened;

    public HashJoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate) {
        this(left, right, predicate, BuildSide.SMALLER);
    }

    public HashJoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate, BuildSide buildSide) {
        this(left, right, predicate, resolveBuildLeft(buildSide, left, right), null);
    }

    /**
     * Uses {@code index} as the build table. The index must cover the key column of one side,
     * and that side must be an unfiltered scan since the index holds every row of its relation.
     */
    public HashJoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate, Index index) {
        this(left, right, predicate, indexSide(left, right, predicate, index), index);
    }

    public HashJoinOperator(Relation left, Relation right, JoinPredicate predicate) {
        this(new ScanOperator(left), new ScanOperator(right), predicate);
    }

    private HashJoinOperator(RowIdStream left, RowIdStream right, JoinPredicate predicate, boolean buildLeft, Index buildIndex) {
        super(left, right, predicate);
        JoinPredicate.EquiKey key = requireEquiKey("Hash", predicate, left, right);
        this.buildLeft = buildLeft;
        this.build = buildLeft ? left : right;
        this.probe = buildLeft ? right : left;
        this.buildKey = build.relation().column(buildLeft ? key.leftColumn() : key.rightColumn());
        this.probeKey = probe.relation().column(buildLeft ? key.rightColumn() : key.leftColumn());
        this.buildIndex = buildIndex;
    }

    private static boolean resolveBuildLeft(BuildSide side, RowIdStream left, RowIdStream right) {
        return switch (side) {
            case LEFT -> true;
            case RIGHT -> false;
            case SMALLER -> left.relation().rowCount() <= right.relation().rowCount();
        };
    }

    private static boolean indexSide(RowIdStream left, RowIdStream right, JoinPredicate predicate, Index index) {
        JoinPredicate.EquiKey key = requireEquiKey("Hash", predicate, left, right);
        boolean onLeft = index.relation() == left.relation() && index.column().equals(key.leftColumn());
        boolean onRight = index.relation() == right.relation() && index.column().equals(key.rightColumn());
        if (!onLeft && !onRight) {
            throw new SchemaException("Index " + index + " does not cover join key " + key);
        }
        RowIdStream side = onLeft ? left : right;
        if (!(side instanceof ScanOperator scan) || !scan.isFullScan()) {
            throw new SchemaException("Index reuse requires an unfiltered scan of " + side.relation().name());
        }
        return onLeft;
    }

    @Override
    public void open() {
        if (opened) return;
        if (buildIndex != null) {
            table = buildIndex::lookup;
            log.debug("Hash join reusing {} as build table", buildIndex);
        } else {
            Map<Object, List<Integer>> hash = new HashMap<>();
            int[] rows = RowIdStream.drain(build);
            for (int r : rows) {
                Object k = buildKey.get(r);
                if (k == null) continue;
                hash.computeIfAbsent(k, x -> new ArrayList<>()).add(r);
            }
            table = k -> hash.getOrDefault(k, Collections.emptyList());
            log.debug("Hash join built {} rows of {} into {} keys", rows.length, build.relation().name(), hash.size());
        }
        probe.open();
        currentProbe = RowIdStream.END;
        currentMatchList = Collections.emptyList();
        matchIndex = 0;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) return null;
        while (true) {
            // If we have remaining matches for the current probe row, emit next combined row.
            if (matchIndex < currentMatchList.size()) {
                int match = currentMatchList.get(matchIndex++);
                return buildLeft ? combine(match, currentProbe) : combine(currentProbe, match);
            }
            currentProbe = probe.next();
            if (currentProbe == RowIdStream.END) return null;
            Object k = probeKey.get(currentProbe);
            currentMatchList = k == null ? Collections.emptyList() : table.apply(k);
            matchIndex = 0;
        }
    }

    @Override
    public void close() {
        probe.close();
        // build side already closed after build
        table = null;
        opened = false;
    }
}

package db.columnar.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.catalog.DataType;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Single-column secondary index: distinct present value -> row positions, ascending.
 * Keys are kept in the column type's order so equality and range lookups share one map.
 *
 * An index is a point-in-time snapshot of the column. Updates to the relation are
 * not reflected; rebuild after mutating.
 */
public final class Index {
    private static final Logger log = LoggerFactory.getLogger(Index.class);

    private final Relation relation;
    private final String column;
    private final DataType type;
    private final NavigableMap<Object, List<Integer>> entries;
    private final int size;

    private Index(Relation relation, String column, DataType type, NavigableMap<Object, List<Integer>> entries, int size) {
        this.relation = relation;
        this.column = column;
        this.type = type;
        this.entries = entries;
        this.size = size;
    }

    public static Index build(Relation relation, String column) {
        Column col = relation.column(column);
        DataType type = col.type();
        NavigableMap<Object, List<Integer>> entries = new TreeMap<>(type::compare);
        int size = 0;
        for (int row = 0; row < col.size(); row++) {
            Object v = col.get(row);
            if (v == null) continue; // absent values are never indexed
            entries.computeIfAbsent(v, k -> new ArrayList<>()).add(row);
            size++;
        }
        log.debug("Built index on {}.{}: {} rows, {} distinct keys", relation.name(), column, size, entries.size());
        return new Index(relation, column, type, entries, size);
    }

    /** Positions holding {@code value}; empty for an unmatched or null value. */
    public List<Integer> lookup(Object value) {
        Object key = type.normalize(value);
        if (key == null) return List.of();
        List<Integer> rows = entries.get(key);
        return rows == null ? List.of() : Collections.unmodifiableList(rows);
    }

    /**
     * Positions whose value lies in [lowInclusive, highInclusive], ascending by row.
     * An empty range (low > high) yields an empty list.
     */
    public List<Integer> range(Object lowInclusive, Object highInclusive) {
        Object low = type.normalize(lowInclusive);
        Object high = type.normalize(highInclusive);
        if (low == null || high == null || type.compare(low, high) > 0) return List.of();
        return collect(entries.subMap(low, true, high, true));
    }

    /** Positions of every key accepted by {@code keyFilter}, ascending by row. */
    public List<Integer> select(Predicate<Object> keyFilter) {
        NavigableMap<Object, List<Integer>> matched = new TreeMap<>(type::compare);
        for (Map.Entry<Object, List<Integer>> e : entries.entrySet()) {
            if (keyFilter.test(e.getKey())) matched.put(e.getKey(), e.getValue());
        }
        return collect(matched);
    }

    private static List<Integer> collect(Map<Object, List<Integer>> slice) {
        List<Integer> out = new ArrayList<>();
        for (List<Integer> rows : slice.values()) out.addAll(rows);
        Collections.sort(out);
        return out;
    }

    public Relation relation() { return relation; }

    public String column() { return column; }

    public DataType type() { return type; }

    public int distinctKeys() { return entries.size(); }

    /** Number of indexed (present) rows. */
    public int size() { return size; }

    @Override
    public String toString() {
        return "Index[" + relation.name() + "." + column + " keys=" + entries.size() + "]";
    }
}

package db.columnar.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.columnar.catalog.ColumnSchema;
import db.columnar.catalog.DataType;
import db.columnar.catalog.Schema;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Grouped aggregation over the positions of its child.
 *
 * Build phase (on open) makes a single pass, keeping one accumulator per requested
 * aggregate for every distinct group key. A key is the tuple of group-by values; absent
 * values are part of the key, so rows with absent group columns form their own groups.
 * Emit phase returns one row per group: group-by columns first, then aggregates in
 * request order.
 *
 * Without group-by columns exactly one row is produced, even for an empty input
 * (COUNT 0, every other aggregate absent).
 */
public class AggregateOperator implements Operator {
    private static final Logger log = LoggerFactory.getLogger(AggregateOperator.class);

    /** Order in which groups are emitted. */
    public enum GroupOrder {
        /** order in which each group's first row was seen */
        FIRST_SEEN,
        /** ascending by group key, absent values last */
        SORTED
    }

    private final RowIdStream child;
    private final Column[] groupColumns;
    private final List<AggregateCall> calls;
    private final Column[] callSources; // null entry for COUNT(*)
    private final GroupOrder groupOrder;
    private final Schema schema;

    private Iterator<Map.Entry<List<Object>, Accumulator[]>> output;

    public AggregateOperator(RowIdStream child, List<String> groupBy, List<AggregateCall> calls) {
        this(child, groupBy, calls, GroupOrder.FIRST_SEEN);
    }

    public AggregateOperator(RowIdStream child, List<String> groupBy, List<AggregateCall> calls, GroupOrder groupOrder) {
        this.child = child;
        this.calls = List.copyOf(calls);
        this.groupOrder = groupOrder;
        Relation rel = child.relation();
        List<ColumnSchema> defs = new ArrayList<>();
        this.groupColumns = new Column[groupBy.size()];
        for (int i = 0; i < groupBy.size(); i++) {
            groupColumns[i] = rel.column(groupBy.get(i));
            defs.add(new ColumnSchema(groupBy.get(i), groupColumns[i].type()));
        }
        this.callSources = new Column[calls.size()];
        for (int i = 0; i < calls.size(); i++) {
            AggregateCall call = calls.get(i);
            callSources[i] = call.column() == null ? null : rel.column(call.column());
            DataType sourceType = callSources[i] == null ? null : callSources[i].type();
            defs.add(new ColumnSchema(call.outputName(), call.function().resultType(sourceType)));
        }
        this.schema = new Schema(defs);
    }

    @Override
    public void open() {
        Map<List<Object>, Accumulator[]> groups = new LinkedHashMap<>();
        child.open();
        int row;
        int seen = 0;
        while ((row = child.next()) != RowIdStream.END) {
            List<Object> key = new ArrayList<>(groupColumns.length);
            for (Column c : groupColumns) key.add(c.get(row));
            Accumulator[] accs = groups.computeIfAbsent(key, k -> newAccumulators());
            for (int i = 0; i < accs.length; i++) {
                accs[i].add(callSources[i] == null ? null : callSources[i].get(row));
            }
            seen++;
        }
        child.close();
        if (groups.isEmpty() && groupColumns.length == 0) {
            groups.put(List.of(), newAccumulators());
        }
        log.debug("Aggregated {} rows into {} groups", seen, groups.size());

        List<Map.Entry<List<Object>, Accumulator[]>> entries = new ArrayList<>(groups.entrySet());
        if (groupOrder == GroupOrder.SORTED) entries.sort(Map.Entry.comparingByKey(keyComparator()));
        output = entries.iterator();
    }

    private Accumulator[] newAccumulators() {
        Accumulator[] accs = new Accumulator[calls.size()];
        for (int i = 0; i < accs.length; i++) {
            accs[i] = Accumulator.create(calls.get(i).function(), callSources[i] == null ? null : callSources[i].type());
        }
        return accs;
    }

    private Comparator<List<Object>> keyComparator() {
        return (a, b) -> {
            for (int i = 0; i < groupColumns.length; i++) {
                int c = groupColumns[i].type().compareAbsentLast(a.get(i), b.get(i));
                if (c != 0) return c;
            }
            return 0;
        };
    }

    @Override
    public Row next() {
        if (output == null || !output.hasNext()) return null;
        Map.Entry<List<Object>, Accumulator[]> group = output.next();
        List<Object> values = new ArrayList<>(schema.size());
        values.addAll(group.getKey());
        for (Accumulator acc : group.getValue()) values.add(acc.result());
        return Row.of(values, schema);
    }

    @Override
    public void close() { output = null; }

    @Override
    public Schema schema() { return schema; }

    @Override
    public String toString() {
        return "AggregateOperator" + schema.names();
    }
}

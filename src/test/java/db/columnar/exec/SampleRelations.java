package db.columnar.exec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import db.columnar.storage.Column;
import db.columnar.storage.Relation;

// Shared fixtures for operator tests.
final class SampleRelations {
    private SampleRelations() {}

    static Relation sales() {
        return Relation.builder("Sales")
                .column("region", Column.ofVarchars("east", "west", "east"))
                .column("amount", Column.ofInts(10L, 5L, 3L))
                .build();
    }

    static Relation left() {
        return Relation.builder("Left")
                .column("id", Column.ofInts(1L, 2L))
                .column("name", Column.ofVarchars("a", "b"))
                .build();
    }

    static Relation right() {
        return Relation.builder("Right")
                .column("id", Column.ofInts(1L, 3L))
                .column("val", Column.ofInts(100L, 200L))
                .build();
    }

    /** id, name, age, active with absent values sprinkled in. */
    static Relation people() {
        return Relation.builder("people")
                .column("id", Column.ofInts(1L, 2L, 3L, 4L, 5L))
                .column("name", Column.ofVarchars("ann", "bob", null, "dee", "bob"))
                .column("age", Column.ofInts(31L, null, 25L, 40L, 25L))
                .column("active", Column.ofBooleans(true, false, true, null, true))
                .build();
    }

    static List<Integer> positions(RowIdStream stream) {
        List<Integer> out = new ArrayList<>();
        for (int r : RowIdStream.drain(stream)) out.add(r);
        return out;
    }

    static List<List<Object>> rows(Operator op) {
        List<List<Object>> out = new ArrayList<>();
        op.open();
        Row row;
        while ((row = op.next()) != null) out.add(row.values());
        op.close();
        return out;
    }

    /** Rows in a canonical order, for comparing results as multisets. */
    static List<List<Object>> sortedRows(Operator op) {
        List<List<Object>> out = rows(op);
        out.sort(Comparator.comparing(Object::toString));
        return out;
    }

    static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }
}

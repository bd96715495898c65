package db.columnar.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.columnar.error.SchemaException;
import db.columnar.exec.SortOperator.Order;
import db.columnar.exec.SortOperator.SortKey;
import db.columnar.storage.Relation;

public class SortOperatorTest {

    @Test
    void ascendingKeepsTiesStableAndAbsentLast() {
        Relation people = SampleRelations.people();
        // ages 31, -, 25, 40, 25
        assertEquals(List.of(2, 4, 0, 3, 1),
                SampleRelations.positions(new SortOperator(new ScanOperator(people), "age", Order.ASC)));
    }

    @Test
    void descendingStillPutsAbsentLast() {
        Relation people = SampleRelations.people();
        assertEquals(List.of(3, 0, 2, 4, 1),
                SampleRelations.positions(new SortOperator(new ScanOperator(people), "age", Order.DESC)));
    }

    @Test
    void laterKeysBreakTies() {
        Relation people = SampleRelations.people();
        SortOperator sort = new SortOperator(new ScanOperator(people), List.of(SortKey.asc("age"), SortKey.desc("id")));
        assertEquals(List.of(4, 2, 0, 3, 1), SampleRelations.positions(sort));
    }

    @Test
    void sortsOnlyWhatTheChildEmits() {
        Relation people = SampleRelations.people();
        RowIdStream bobs = new FilterOperator(new ScanOperator(people), Predicate.eq("name", "bob"));
        assertEquals(List.of(4, 1), SampleRelations.positions(new SortOperator(bobs, "id", Order.DESC)));
    }

    @Test
    void rejectsMissingOrUnknownKeys() {
        ScanOperator scan = new ScanOperator(SampleRelations.people());
        assertThrows(IllegalArgumentException.class, () -> new SortOperator(scan, List.of()));
        assertThrows(SchemaException.class, () -> new SortOperator(scan, "nope", Order.ASC));
    }
}

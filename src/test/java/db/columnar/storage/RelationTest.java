package db.columnar.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import db.columnar.catalog.DataType;
import db.columnar.catalog.Schema;
import db.columnar.error.SchemaException;
import db.columnar.error.TypeMismatchException;

public class RelationTest {

    private static final Schema PEOPLE = Schema.builder()
            .column("id", DataType.INT)
            .column("name", DataType.VARCHAR)
            .column("score", DataType.FLOAT)
            .build();

    private static Relation people() {
        return Relation.fromRows("people", PEOPLE, List.of(
                Arrays.asList(1L, "ann", 3.5),
                Arrays.asList(2L, null, 1.0),
                Arrays.asList(3L, "cy", null)));
    }

    @Test
    void fromRowsStoresValuesInColumnOrder() {
        Relation rel = people();
        assertEquals(3, rel.rowCount());
        assertEquals(List.of("id", "name", "score"), rel.columnNames());
        assertEquals(Arrays.asList(2L, null, 1.0), rel.row(1));
        assertEquals("cy", rel.get(2, "name"));
        assertNull(rel.get(2, "score"));
    }

    @Test
    void fromRowsRejectsBadRowsBeforeStoringAnything() {
        assertThrows(SchemaException.class, () -> Relation.fromRows("p", PEOPLE, List.of(Arrays.asList(1L, "a"))));
        assertThrows(TypeMismatchException.class, () -> Relation.fromRows("p", PEOPLE, List.of(
                Arrays.asList(1L, "a", 1.0),
                Arrays.asList("2", "b", 2.0))));
    }

    @Test
    void appendRowIsAllOrNothing() {
        Relation rel = people();
        Relation before = rel.copy("before");
        assertThrows(TypeMismatchException.class, () -> rel.appendRow(Arrays.asList(4L, "dee", "oops")));
        assertEquals(before, rel);
        for (String c : rel.columnNames()) assertEquals(3, rel.column(c).size());

        rel.appendRow(Arrays.asList(4, "dee", 2.0f));
        assertEquals(4, rel.rowCount());
        assertEquals(Arrays.asList(4L, "dee", 2.0), rel.row(3));
    }

    @Test
    void iterRowsPreservesColumnOrderAndAbsence() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : people().iterRows()) rows.add(row);
        assertEquals(3, rows.size());
        assertEquals(List.of("id", "name", "score"), new ArrayList<>(rows.get(0).keySet()));
        assertTrue(rows.get(1).containsKey("name"));
        assertNull(rows.get(1).get("name"));
    }

    @Test
    void typedReadChecksColumnType() {
        Relation rel = people();
        assertEquals(1L, rel.get(0, "id", DataType.INT));
        assertThrows(TypeMismatchException.class, () -> rel.get(0, "id", DataType.VARCHAR));
        assertThrows(SchemaException.class, () -> rel.get(0, "missing"));
        assertThrows(IndexOutOfBoundsException.class, () -> rel.row(3));
    }

    @Test
    void builderRejectsDuplicateNamesAndUnevenColumns() {
        assertThrows(SchemaException.class, () -> Relation.builder("r")
                .column("a", Column.ofInts(1L))
                .column("a", Column.ofInts(2L)));
        assertThrows(SchemaException.class, () -> Relation.builder("r")
                .column("a", Column.ofInts(1L, 2L))
                .column("b", Column.ofVarchars("x"))
                .build());
    }

    @Test
    void builtRelationsOwnTheirColumns() {
        Column shared = Column.ofInts(1L, 2L);
        Relation a = Relation.builder("a").column("x", shared).build();
        Relation b = Relation.builder("b").column("x", shared).build();
        a.set(0, "x", 9L);
        assertEquals(9L, a.get(0, "x"));
        assertEquals(1L, b.get(0, "x"));
        assertEquals(1L, shared.get(0));
        assertNotSame(a.column("x"), b.column("x"));
    }

    @Test
    void setOverwritesOneValueInPlace() {
        Relation rel = people();
        rel.set(1, "name", "bo");
        rel.set(0, "score", null);
        assertEquals(Arrays.asList(2L, "bo", 1.0), rel.row(1));
        assertNull(rel.get(0, "score"));
        assertEquals(3, rel.rowCount());
        assertThrows(TypeMismatchException.class, () -> rel.set(0, "id", "one"));
        assertThrows(SchemaException.class, () -> rel.set(0, "missing", 1L));
        assertThrows(IndexOutOfBoundsException.class, () -> rel.set(3, "id", 4L));
        for (String c : rel.columnNames()) assertEquals(rel.rowCount(), rel.column(c).size());
    }

    @Test
    void emptyRelationHasSchemaButNoRows() {
        Relation rel = Relation.empty("e", PEOPLE);
        assertEquals(0, rel.rowCount());
        assertEquals(PEOPLE, rel.schema());
        assertFalse(rel.iterRows().iterator().hasNext());
    }

    @Test
    void selectAndCopyDoNotShareStorage() {
        Relation rel = people();
        Relation picked = rel.select("picked", new int[] {2, 0});
        Relation copy = rel.copy("copy");
        assertEquals(Arrays.asList(3L, "cy", null), picked.row(0));
        assertEquals(rel, copy);

        rel.set(0, "name", "changed");
        assertEquals("ann", picked.get(1, "name"));
        assertEquals("ann", copy.get(0, "name"));
        assertNotEquals(rel, copy);
    }
}

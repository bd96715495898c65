package db.columnar.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

import db.columnar.exec.AggregateCall;
import db.columnar.exec.AggregateOperator;
import db.columnar.exec.FilterOperator;
import db.columnar.exec.HashJoinOperator;
import db.columnar.exec.JoinPredicate;
import db.columnar.exec.Predicate;
import db.columnar.exec.ProjectionOperator;
import db.columnar.exec.Row;
import db.columnar.exec.ScanOperator;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

public class QueryExecutorTest {

    private final QueryExecutor executor = new QueryExecutor();

    private static Relation students() {
        return Relation.builder("students")
                .column("id", Column.ofInts(1L, 2L, 3L))
                .column("name", Column.ofVarchars("Alice", "Bob", "Eve"))
                .build();
    }

    private static Relation enrollments() {
        return Relation.builder("enrollments")
                .column("student_id", Column.ofInts(1L, 1L, 2L, 3L))
                .column("course", Column.ofVarchars("Math", "Physics", "Chemistry", "Math"))
                .build();
    }

    @Test
    void streamPullsRowsLazily() {
        ProjectionOperator proj = ProjectionOperator.forColumnNames(new ScanOperator(students()), List.of("name"));
        List<Object> names = new ArrayList<>();
        for (Row row : executor.stream(proj)) names.add(row.get("name"));
        assertEquals(List.of("Alice", "Bob", "Eve"), names);
    }

    @Test
    void exhaustedStreamThrowsOnNext() {
        Relation empty = Relation.empty("e", students().schema());
        Iterator<Row> it = executor.stream(ProjectionOperator.forColumnNames(new ScanOperator(empty), List.of("id"))).iterator();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void materializesJoinThenAggregatePipeline() {
        HashJoinOperator join = new HashJoinOperator(students(), enrollments(), JoinPredicate.equal("id", "student_id"));
        Relation joined = executor.materialize(join, "joined");
        assertEquals(List.of("id", "name", "student_id", "course"), joined.columnNames());
        assertEquals(4, joined.rowCount());

        AggregateOperator perCourse = new AggregateOperator(new ScanOperator(joined), List.of("course"), List.of(AggregateCall.count()));
        Relation counts = executor.materialize(perCourse, "counts");
        assertEquals(List.of("course", "count"), counts.columnNames());
        List<List<Object>> rows = new ArrayList<>();
        for (int r = 0; r < counts.rowCount(); r++) rows.add(counts.row(r));
        assertTrue(rows.contains(Arrays.asList("Math", 2L)));
        assertTrue(rows.contains(Arrays.asList("Physics", 1L)));
        assertEquals(3, rows.size());
    }

    @Test
    void materializesSelectedRowsOfAStream() {
        FilterOperator math = new FilterOperator(new ScanOperator(enrollments()), Predicate.eq("course", "Math"));
        Relation out = executor.materialize(math, "math");
        assertEquals(2, out.rowCount());
        assertEquals(Arrays.asList(3L, "Math"), out.row(1));
    }

    @Test
    void rowIdsDrainsPositions() {
        FilterOperator ones = new FilterOperator(new ScanOperator(enrollments()), Predicate.eq("student_id", 1L));
        assertArrayEquals(new int[] {0, 1}, executor.rowIds(ones));
    }
}

package db.columnar.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import db.columnar.config.EngineConfig;
import db.columnar.error.SchemaException;
import db.columnar.error.TypeMismatchException;
import db.columnar.exec.AggregateCall;
import db.columnar.exec.AggregateOperator;
import db.columnar.exec.Assignment;
import db.columnar.exec.ComparisonPredicate.Op;
import db.columnar.exec.FilterOperator;
import db.columnar.exec.HashJoinOperator;
import db.columnar.exec.JoinOperator;
import db.columnar.exec.JoinPredicate;
import db.columnar.exec.NestedLoopJoinOperator;
import db.columnar.exec.Predicate;
import db.columnar.exec.Row;
import db.columnar.exec.RowIdStream;
import db.columnar.exec.ScanOperator;
import db.columnar.exec.SortMergeJoinOperator;
import db.columnar.storage.Column;
import db.columnar.storage.Relation;

public class DatabaseTest {

    private static Database seeded(EngineConfig config) {
        Database db = new Database("shop", config);
        Relation customers = db.createRelation("customers", Schema.builder()
                .column("id", DataType.INT)
                .column("name", DataType.VARCHAR)
                .build());
        customers.appendRow(Arrays.asList(1L, "ann"));
        customers.appendRow(Arrays.asList(2L, "bob"));
        customers.appendRow(Arrays.asList(3L, null));
        db.addRelation(Relation.builder("orders")
                .column("customer_id", Column.ofInts(2L, 1L, 2L, 9L))
                .column("total", Column.ofFloats(5.0, 7.5, 1.25, 3.0))
                .build());
        return db;
    }

    private static List<Integer> positions(RowIdStream stream) {
        int[] rows = RowIdStream.drain(stream);
        Integer[] boxed = new Integer[rows.length];
        for (int i = 0; i < rows.length; i++) boxed[i] = rows[i];
        return Arrays.asList(boxed);
    }

    private static int count(JoinOperator join) {
        int n = 0;
        join.open();
        while (join.next() != null) n++;
        join.close();
        return n;
    }

    @Test
    void registersAndDropsRelations() {
        Database db = seeded(EngineConfig.defaults());
        assertEquals(List.of("customers", "orders"), db.relationNames());
        assertEquals(3, db.relation("customers").rowCount());
        assertThrows(SchemaException.class, () -> db.addRelation(Relation.builder("orders").build()));
        assertThrows(SchemaException.class, () -> db.relation("nope"));

        db.createIndex("orders", "customer_id");
        assertTrue(db.dropRelation("orders"));
        assertFalse(db.dropRelation("orders"));
        assertTrue(db.index("orders", "customer_id").isEmpty());
        assertEquals(List.of("customers"), db.relationNames());
    }

    @Test
    void scanUsesIndexForEqualityOnIndexedColumn() {
        Database db = seeded(EngineConfig.defaults());
        db.createIndex("orders", "customer_id");
        RowIdStream indexed = db.scan("orders", Predicate.eq("customer_id", 2L));
        assertTrue(indexed instanceof ScanOperator);
        assertFalse(((ScanOperator) indexed).isFullScan());
        assertEquals(List.of(0, 2), positions(indexed));

        RowIdStream filtered = db.scan("orders", Predicate.gt("customer_id", 1L));
        assertTrue(filtered instanceof FilterOperator);
        assertEquals(List.of(0, 2, 3), positions(filtered));

        assertEquals(List.of(0, 1, 2, 3), positions(db.scan("orders", null)));
    }

    @Test
    void indexedScanStillValidatesLiteralType() {
        Database db = seeded(EngineConfig.defaults());
        db.createIndex("customers", "id");
        assertThrows(TypeMismatchException.class, () -> db.scan("customers", Predicate.eq("id", "1")));
        assertThrows(SchemaException.class, () -> db.createIndex("customers", "missing"));
    }

    @Test
    void joinUsesConfiguredStrategyForEquality() {
        JoinPredicate on = JoinPredicate.equal("id", "customer_id");
        Database hash = seeded(EngineConfig.defaults());
        Database merge = seeded(EngineConfig.fromJson("{\"join\": {\"defaultStrategy\": \"SORT_MERGE\"}}"));
        Database loop = seeded(EngineConfig.fromJson("{\"join\": {\"defaultStrategy\": \"NESTED_LOOP\"}}"));

        assertTrue(hash.join("customers", "orders", on) instanceof HashJoinOperator);
        assertTrue(merge.join("customers", "orders", on) instanceof SortMergeJoinOperator);
        assertTrue(loop.join("customers", "orders", on) instanceof NestedLoopJoinOperator);
        assertEquals(3, count(hash.join("customers", "orders", on)));
        assertEquals(3, count(merge.join("customers", "orders", on)));
        assertEquals(3, count(loop.join("customers", "orders", on)));
    }

    @Test
    void nonEquiJoinFallsBackToNestedLoop() {
        Database db = seeded(EngineConfig.defaults());
        JoinOperator join = db.join("customers", "orders", JoinPredicate.compare("id", Op.LT, "customer_id"));
        assertTrue(join instanceof NestedLoopJoinOperator);
        // ids 1,2,3 against 2,1,2,9
        assertEquals(5, count(join));
    }

    @Test
    void hashJoinReusesCachedIndex() {
        Database db = seeded(EngineConfig.defaults());
        db.createIndex("orders", "customer_id");
        JoinOperator join = db.join("customers", "orders", JoinPredicate.equal("id", "customer_id"));
        assertTrue(join instanceof HashJoinOperator);
        assertEquals(3, count(join));
    }

    @Test
    void aggregateUsesConfiguredGroupOrder() {
        Database db = seeded(EngineConfig.fromJson("{\"aggregate\": {\"groupOrder\": \"SORTED\"}}"));
        AggregateOperator agg = db.aggregate(db.scan("orders", null), List.of("customer_id"), List.of(AggregateCall.sum("total")));
        agg.open();
        Row first = agg.next();
        assertEquals(1L, first.get("customer_id"));
        assertEquals(7.5, first.get("sum_total"));
        assertEquals(2L, agg.next().get("customer_id"));
        agg.close();
    }

    @Test
    void updateRefreshesCachedIndexes() {
        Database db = seeded(EngineConfig.defaults());
        db.createIndex("customers", "name");
        int n = db.update("customers", Predicate.eq("id", 3L), List.of(Assignment.set("name", "cy")));
        assertEquals(1, n);
        assertEquals(List.of(2), db.index("customers", "name").orElseThrow().lookup("cy"));
        assertEquals(List.of(2), positions(db.scan("customers", Predicate.eq("name", "cy"))));
    }

    @Test
    void catalogJsonDescribesRelationsAndIndexes() {
        Database db = seeded(EngineConfig.defaults());
        db.createIndex("orders", "customer_id");
        JsonObject catalog = JsonParser.parseString(db.catalogJson()).getAsJsonObject();
        assertEquals(3, catalog.getAsJsonObject("customers").get("rows").getAsInt());
        assertEquals(0, catalog.getAsJsonObject("customers").getAsJsonArray("indexes").size());
        JsonObject orders = catalog.getAsJsonObject("orders");
        assertEquals("customer_id", orders.getAsJsonArray("indexes").get(0).getAsString());
        JsonObject total = orders.getAsJsonArray("columns").get(1).getAsJsonObject();
        assertEquals("total", total.get("name").getAsString());
        assertEquals("FLOAT", total.get("type").getAsString());
    }

    @Test
    void defaultConstructorLoadsBundledConfig() {
        Database db = new Database("plain");
        assertEquals(EngineConfig.JoinStrategy.HASH, db.config().defaultJoinStrategy());
        assertEquals("plain", db.name());
    }
}

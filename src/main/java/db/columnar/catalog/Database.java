package db.columnar.catalog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import db.columnar.config.EngineConfig;
import db.columnar.error.SchemaException;
import db.columnar.exec.AggregateCall;
import db.columnar.exec.AggregateOperator;
import db.columnar.exec.Assignment;
import db.columnar.exec.ComparisonPredicate;
import db.columnar.exec.FilterOperator;
import db.columnar.exec.HashJoinOperator;
import db.columnar.exec.JoinOperator;
import db.columnar.exec.JoinPredicate;
import db.columnar.exec.NestedLoopJoinOperator;
import db.columnar.exec.Predicate;
import db.columnar.exec.RowIdStream;
import db.columnar.exec.ScanOperator;
import db.columnar.exec.SortMergeJoinOperator;
import db.columnar.exec.UpdateOperator;
import db.columnar.index.Index;
import db.columnar.storage.Relation;

/**
 * Named registry of in-memory relations and the indexes built over them.
 *
 * Indexes cached here are rebuilt after {@link #update}; a relation mutated directly through
 * an {@link UpdateOperator} needs an explicit {@link #rebuildIndexes} call.
 */
public class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final String name;
    private final EngineConfig config;
    private final Map<String, Relation> relations = new LinkedHashMap<>();
    private final Map<String, Map<String, Index>> indexes = new HashMap<>();

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public Database(String name) {
        this(name, EngineConfig.load());
    }

    public Database(String name, EngineConfig config) {
        this.name = name;
        this.config = config;
    }

    public String name() { return name; }

    public EngineConfig config() { return config; }

    public Relation createRelation(String relationName, Schema schema) {
        Relation rel = Relation.empty(relationName, schema);
        addRelation(rel);
        return rel;
    }

    public void addRelation(Relation relation) {
        if (relations.containsKey(relation.name())) {
            throw new SchemaException("Relation already exists: " + relation.name());
        }
        relations.put(relation.name(), relation);
        log.debug("Registered relation {} with columns {} ({} rows)", relation.name(), relation.columnNames(), relation.rowCount());
    }

    public Relation relation(String relationName) {
        Relation rel = relations.get(relationName);
        if (rel == null) throw new SchemaException("Relation not found: " + relationName);
        return rel;
    }

    public boolean dropRelation(String relationName) {
        indexes.remove(relationName);
        return relations.remove(relationName) != null;
    }

    public List<String> relationNames() { return new ArrayList<>(relations.keySet()); }

    public Index createIndex(String relationName, String column) {
        Index index = Index.build(relation(relationName), column);
        indexes.computeIfAbsent(relationName, k -> new TreeMap<>()).put(column, index);
        return index;
    }

    public Optional<Index> index(String relationName, String column) {
        Map<String, Index> byColumn = indexes.get(relationName);
        return Optional.ofNullable(byColumn == null ? null : byColumn.get(column));
    }

    public void rebuildIndexes(String relationName) {
        Map<String, Index> byColumn = indexes.get(relationName);
        if (byColumn == null) return;
        Relation rel = relation(relationName);
        byColumn.replaceAll((column, stale) -> Index.build(rel, column));
    }

    /**
     * Row stream over {@code relationName} filtered by {@code predicate} (null for all rows).
     * An equality comparison on an indexed column is answered by an index scan.
     */
    public RowIdStream scan(String relationName, Predicate predicate) {
        Relation rel = relation(relationName);
        if (predicate == null) return new ScanOperator(rel);
        if (predicate instanceof ComparisonPredicate cmp && cmp.op() == ComparisonPredicate.Op.EQ) {
            Optional<Index> idx = index(relationName, cmp.column());
            if (idx.isPresent()) {
                predicate.bind(rel); // same validation as the filter path
                return new ScanOperator(idx.get(), cmp.literal());
            }
        }
        return new FilterOperator(new ScanOperator(rel), predicate);
    }

    /**
     * Joins two registered relations. Equality predicates use the configured strategy (the hash
     * strategy reuses a cached index on either key column); anything else runs as a nested loop.
     */
    public JoinOperator join(String leftName, String rightName, JoinPredicate predicate) {
        Relation left = relation(leftName);
        Relation right = relation(rightName);
        JoinPredicate.EquiKey key = predicate.equiKey();
        if (key == null) return new NestedLoopJoinOperator(left, right, predicate);
        return switch (config.defaultJoinStrategy()) {
            case NESTED_LOOP -> new NestedLoopJoinOperator(left, right, predicate);
            case SORT_MERGE -> new SortMergeJoinOperator(left, right, predicate);
            case HASH -> {
                Optional<Index> idx = index(rightName, key.rightColumn()).or(() -> index(leftName, key.leftColumn()));
                yield idx.isPresent()
                        ? new HashJoinOperator(new ScanOperator(left), new ScanOperator(right), predicate, idx.get())
                        : new HashJoinOperator(new ScanOperator(left), new ScanOperator(right), predicate, config.hashBuildSide());
            }
        };
    }

    public AggregateOperator aggregate(RowIdStream input, List<String> groupBy, List<AggregateCall> calls) {
        return new AggregateOperator(input, groupBy, calls, config.groupOrder());
    }

    /**
     * Runs an update against a registered relation, then refreshes its cached indexes.
     */
    public int update(String relationName, Predicate predicate, List<Assignment> assignments) {
        int updated = new UpdateOperator(relation(relationName), predicate, assignments).execute();
        if (updated > 0) rebuildIndexes(relationName);
        return updated;
    }

    /**
     * Catalog of registered relations as JSON: name -> columns, row count and indexed columns.
     */
    public String catalogJson() {
        Map<String, Object> catalog = new LinkedHashMap<>();
        for (Relation rel : relations.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("columns", rel.schema().columns());
            entry.put("rows", rel.rowCount());
            Map<String, Index> byColumn = indexes.get(rel.name());
            entry.put("indexes", byColumn == null ? List.of() : new ArrayList<>(byColumn.keySet()));
            catalog.put(rel.name(), entry);
        }
        return gson.toJson(catalog);
    }
}

package db.columnar.exec;

import java.util.Set;
import java.util.function.IntPredicate;

import db.columnar.storage.Relation;

/**
 * Boolean expression over the columns of one relation.
 * {@link #bind} resolves column names and checks literal types against a relation,
 * so reference errors surface before any row is evaluated.
 */
public interface Predicate {
    IntPredicate bind(Relation relation);

    /** Names of the columns this predicate reads. */
    Set<String> columns();

    static Predicate eq(String column, Object value) { return new ComparisonPredicate(column, ComparisonPredicate.Op.EQ, value); }
    static Predicate ne(String column, Object value) { return new ComparisonPredicate(column, ComparisonPredicate.Op.NE, value); }
    static Predicate lt(String column, Object value) { return new ComparisonPredicate(column, ComparisonPredicate.Op.LT, value); }
    static Predicate lte(String column, Object value) { return new ComparisonPredicate(column, ComparisonPredicate.Op.LTE, value); }
    static Predicate gt(String column, Object value) { return new ComparisonPredicate(column, ComparisonPredicate.Op.GT, value); }
    static Predicate gte(String column, Object value) { return new ComparisonPredicate(column, ComparisonPredicate.Op.GTE, value); }
}

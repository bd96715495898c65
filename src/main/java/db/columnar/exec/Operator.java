package db.columnar.exec;

import db.columnar.catalog.Schema;

/**
 * Pull contract for operators that produce value rows (projections, aggregates, joins).
 * The output schema is resolved at construction, before any row is pulled.
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    Schema schema();
}

package db.columnar.catalog;

// Immutable data carrier for a relation column.
public record ColumnSchema(String name, DataType type) {}

package db.columnar.error;

/**
 * Unknown or duplicate column/relation names and row-count disagreements.
 */
public class SchemaException extends EngineException {
    public SchemaException(String message) {
        super(message);
    }

    public static SchemaException unknownColumn(String relation, String column) {
        return new SchemaException("Column not found in " + relation + ": " + column);
    }
}

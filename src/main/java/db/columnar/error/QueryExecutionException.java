package db.columnar.error;

/**
 * Failure detected while a pipeline is being drained, e.g. integer overflow in SUM.
 */
public class QueryExecutionException extends EngineException {
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

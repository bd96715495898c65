package db.columnar.error;

// Thrown by join strategies that only handle a single equality key.
public class UnsupportedPredicateException extends EngineException {
    public UnsupportedPredicateException(String message) {
        super(message);
    }
}

package db.columnar.error;

/**
 * Base type of every failure the engine reports to its caller.
 * Unchecked: errors surface synchronously at construction or first evaluation.
 */
public class EngineException extends RuntimeException {
    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

package db.columnar.error;

import db.columnar.catalog.DataType;

/**
 * A value, literal, column or join key disagrees with the type it is used against.
 */
public class TypeMismatchException extends EngineException {
    public TypeMismatchException(String message) {
        super(message);
    }

    public static TypeMismatchException forValue(DataType expected, Object value) {
        return new TypeMismatchException("Expected value of type " + expected + " but got "
                + (value == null ? "null" : value.getClass().getSimpleName() + " " + value));
    }

    public static TypeMismatchException forColumn(String column, DataType expected, DataType actual) {
        return new TypeMismatchException("Column '" + column + "' has type " + actual + ", requested " + expected);
    }
}

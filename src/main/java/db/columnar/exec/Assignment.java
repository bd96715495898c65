package db.columnar.exec;

import java.util.function.UnaryOperator;

/**
 * One column assignment of an update: either a constant (null marks the slot absent)
 * or a function deriving the new value from the row's current value.
 */
public final class Assignment {
    private final String column;
    private final Object value;
    private final UnaryOperator<Object> function;

    private Assignment(String column, Object value, UnaryOperator<Object> function) {
        this.column = column;
        this.value = value;
        this.function = function;
    }

    public static Assignment set(String column, Object value) {
        return new Assignment(column, value, null);
    }

    public static Assignment compute(String column, UnaryOperator<Object> function) {
        return new Assignment(column, null, function);
    }

    public String column() { return column; }

    public boolean isConstant() { return function == null; }

    /** New value for a slot currently holding {@code current}. */
    public Object valueFor(Object current) {
        return function == null ? value : function.apply(current);
    }

    @Override
    public String toString() {
        return column + " = " + (function == null ? value : "f(" + column + ")");
    }
}

package db.columnar.exec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import db.columnar.catalog.DataType;
import db.columnar.error.QueryExecutionException;

/**
 * Running state of one aggregate for one group. {@link #add} receives the source value
 * of every row in the group, null when absent.
 */
abstract class Accumulator {

    abstract void add(Object value);

    abstract Object result();

    static Accumulator create(AggregateFunction function, DataType source) {
        return switch (function) {
            case COUNT -> new Count();
            case SUM -> source == DataType.INT ? new IntSum() : new FloatSum();
            case AVG -> source == DataType.INT ? new IntAverage() : new FloatAverage();
            case MIN -> new Extreme(source, false);
            case MAX -> new Extreme(source, true);
        };
    }

    // COUNT ignores presence.
    static final class Count extends Accumulator {
        private long count;

        @Override
        void add(Object value) { count++; }

        @Override
        Object result() { return count; }
    }

    static final class IntSum extends Accumulator {
        private long sum;
        private boolean any;

        @Override
        void add(Object value) {
            if (value == null) return;
            sum = addExact(sum, (Long) value);
            any = true;
        }

        @Override
        Object result() { return any ? sum : null; }
    }

    static final class FloatSum extends Accumulator {
        private double sum;
        private boolean any;

        @Override
        void add(Object value) {
            if (value == null) return;
            sum += (Double) value;
            any = true;
        }

        @Override
        Object result() { return any ? sum : null; }
    }

    // Exact long sum, widened to BigInteger once it leaves the long range; AVG itself never overflows.
    static final class IntAverage extends Accumulator {
        private long sum;
        private BigInteger wide;
        private long count;

        @Override
        void add(Object value) {
            if (value == null) return;
            long v = (Long) value;
            if (wide != null) {
                wide = wide.add(BigInteger.valueOf(v));
            } else {
                long s = sum + v;
                if (((sum ^ s) & (v ^ s)) < 0) {
                    wide = BigInteger.valueOf(sum).add(BigInteger.valueOf(v));
                } else {
                    sum = s;
                }
            }
            count++;
        }

        @Override
        Object result() {
            if (count == 0) return null;
            if (wide == null) return (double) sum / count;
            return new BigDecimal(wide).divide(BigDecimal.valueOf(count), MathContext.DECIMAL128).doubleValue();
        }
    }

    static final class FloatAverage extends Accumulator {
        private double sum;
        private long count;

        @Override
        void add(Object value) {
            if (value == null) return;
            sum += (Double) value;
            count++;
        }

        @Override
        Object result() { return count == 0 ? null : sum / count; }
    }

    static final class Extreme extends Accumulator {
        private final DataType type;
        private final boolean max;
        private Object best;

        Extreme(DataType type, boolean max) {
            this.type = type;
            this.max = max;
        }

        @Override
        void add(Object value) {
            if (value == null) return;
            if (best == null) {
                best = value;
                return;
            }
            int c = type.compare(value, best);
            if (max ? c > 0 : c < 0) best = value;
        }

        @Override
        Object result() { return best; }
    }

    private static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new QueryExecutionException("Integer overflow while summing " + a + " + " + b, e);
        }
    }
}

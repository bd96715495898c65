package db.columnar.exec;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.IntPredicate;

import db.columnar.storage.Column;
import db.columnar.storage.Relation;

/**
 * Logical AND / OR over two or more children, or NOT over exactly one.
 * AND and OR stop at the first child that decides the result.
 *
 * NOT is false on a row where any column its child reads is absent, so negation
 * never lets an absent value through.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<Predicate> children; // for NOT size == 1

    private CompoundPredicate(Type type, List<Predicate> children) {
        int min = type == Type.NOT ? 1 : 2;
        int max = type == Type.NOT ? 1 : Integer.MAX_VALUE;
        if (children.size() < min || children.size() > max) {
            throw new IllegalArgumentException(type + " cannot take " + children.size() + " child predicate(s)");
        }
        this.type = type;
        this.children = List.copyOf(children);
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return new CompoundPredicate(Type.AND, Arrays.asList(predicates));
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return new CompoundPredicate(Type.OR, Arrays.asList(predicates));
    }

    public static CompoundPredicate not(Predicate predicate) {
        return new CompoundPredicate(Type.NOT, List.of(predicate));
    }

    @Override
    public IntPredicate bind(Relation relation) {
        IntPredicate[] bound = new IntPredicate[children.size()];
        for (int i = 0; i < bound.length; i++) bound[i] = children.get(i).bind(relation);
        return switch (type) {
            case AND -> row -> {
                for (IntPredicate p : bound) if (!p.test(row)) return false;
                return true;
            };
            case OR -> row -> {
                for (IntPredicate p : bound) if (p.test(row)) return true;
                return false;
            };
            case NOT -> {
                Column[] read = children.get(0).columns().stream().map(relation::column).toArray(Column[]::new);
                IntPredicate inner = bound[0];
                yield row -> {
                    for (Column c : read) if (!c.isPresent(row)) return false;
                    return !inner.test(row);
                };
            }
        };
    }

    @Override
    public Set<String> columns() {
        Set<String> out = new LinkedHashSet<>();
        for (Predicate p : children) out.addAll(p.columns());
        return out;
    }

    @Override
    public String toString() {
        if (type == Type.NOT) return "NOT(" + children.get(0) + ")";
        StringJoiner sj = new StringJoiner(" " + type + " ", "(", ")");
        for (Predicate p : children) sj.add(String.valueOf(p));
        return sj.toString();
    }
}

package org.scholargraph.query.sql;

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for {@link SqlPredicate}s.
 * <pre>
 * and(ge("p.year", 2020), le("p.year", 2024), or(ilike("f.display_name", "learning"), in("f.display_name", names)))
 * </pre>
 */
public final class Predicates {

    private Predicates() {
    }

    public static SqlPredicate eq(String expression, Object value) {
        return new Comparison(expression, Comparison.Operator.EQ, value);
    }

    public static SqlPredicate ge(String expression, Object value) {
        return new Comparison(expression, Comparison.Operator.GE, value);
    }

    public static SqlPredicate le(String expression, Object value) {
        return new Comparison(expression, Comparison.Operator.LE, value);
    }

    public static SqlPredicate gt(String expression, Object value) {
        return new Comparison(expression, Comparison.Operator.GT, value);
    }

    public static SqlPredicate isNotNull(String expression) {
        return new NotNull(expression);
    }

    public static SqlPredicate ilike(String expression, String text) {
        return new ILike(expression, text);
    }

    public static SqlPredicate in(String expression, List<?> values) {
        return new InList(expression, values);
    }

    public static SqlPredicate in(String expression, SelectQuery subquery) {
        return new InSubquery(expression, subquery);
    }

    public static SqlPredicate and(SqlPredicate... operands) {
        return new Conjunction(Arrays.asList(operands));
    }

    public static SqlPredicate and(List<SqlPredicate> operands) {
        return new Conjunction(operands);
    }

    public static SqlPredicate or(SqlPredicate... operands) {
        return new Disjunction(Arrays.asList(operands));
    }

    public static SqlPredicate or(List<SqlPredicate> operands) {
        return new Disjunction(operands);
    }
}

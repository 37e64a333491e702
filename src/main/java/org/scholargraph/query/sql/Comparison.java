package org.scholargraph.query.sql;

import java.util.Objects;

/**
 * {@code <expression> <operator> <literal>}.
 *
 * @param expression Column or expression on the left-hand side.
 * @param operator   The comparison operator.
 * @param value      The right-hand literal; {@link Number}, {@link Boolean} or {@link String}.
 */
public record Comparison(String expression, Operator operator, Object value) implements SqlPredicate {

    public enum Operator {
        EQ("="), NE("<>"), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public Comparison {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toSql() {
        return expression + " " + operator.symbol() + " " + Literals.render(value);
    }
}

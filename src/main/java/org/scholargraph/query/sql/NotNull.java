package org.scholargraph.query.sql;

import java.util.Objects;

/**
 * {@code <expression> IS NOT NULL}.
 */
public record NotNull(String expression) implements SqlPredicate {

    public NotNull {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public String toSql() {
        return expression + " IS NOT NULL";
    }
}

package org.scholargraph.query.sql;

import java.util.Objects;

/**
 * Semi-join: {@code <expression> IN (SELECT ...)}. Unlike an inner join it never multiplies
 * rows when the subquery returns the same key more than once.
 *
 * @param expression The column to test.
 * @param subquery   A query selecting exactly one column.
 */
public record InSubquery(String expression, SelectQuery subquery) implements SqlPredicate {

    public InSubquery {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(subquery, "subquery");
    }

    @Override
    public String toSql() {
        return expression + " IN (" + subquery.toSql() + ")";
    }
}

package org.scholargraph.query.sql;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code <expression> IN (v1, v2, ...)}. An empty list matches nothing.
 *
 * @param expression The column to test.
 * @param values     The accepted literals.
 */
public record InList(String expression, List<?> values) implements SqlPredicate {

    public InList {
        Objects.requireNonNull(expression, "expression");
        values = List.copyOf(values);
    }

    @Override
    public String toSql() {
        if (values.isEmpty()) {
            return "FALSE";
        }
        return expression + " IN (" + values.stream().map(Literals::render).collect(Collectors.joining(", ")) + ")";
    }
}

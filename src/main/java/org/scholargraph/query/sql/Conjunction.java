package org.scholargraph.query.sql;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All operands must hold. An empty conjunction is {@code TRUE}.
 */
public record Conjunction(List<SqlPredicate> operands) implements SqlPredicate {

    public Conjunction {
        operands = List.copyOf(operands);
    }

    @Override
    public String toSql() {
        if (operands.isEmpty()) {
            return "TRUE";
        }
        if (operands.size() == 1) {
            return operands.get(0).toSql();
        }
        return operands.stream().map(p -> "(" + p.toSql() + ")").collect(Collectors.joining(" AND "));
    }
}

package org.scholargraph.query.sql;

import java.util.List;
import java.util.stream.Collectors;

/**
 * At least one operand must hold. An empty disjunction is {@code FALSE}.
 */
public record Disjunction(List<SqlPredicate> operands) implements SqlPredicate {

    public Disjunction {
        operands = List.copyOf(operands);
    }

    @Override
    public String toSql() {
        if (operands.isEmpty()) {
            return "FALSE";
        }
        if (operands.size() == 1) {
            return operands.get(0).toSql();
        }
        return "(" + operands.stream().map(p -> "(" + p.toSql() + ")").collect(Collectors.joining(" OR ")) + ")";
    }
}

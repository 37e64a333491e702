package org.scholargraph.api.resources.store;

import java.util.List;

/**
 * Tabular result of a store query: the column labels in select order and the rows in
 * the order the engine returned them.
 *
 * @param columns Column labels.
 * @param rows    Result rows.
 */
public record QueryResult(List<String> columns, List<Row> rows) {

    public QueryResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), List.of());
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }
}

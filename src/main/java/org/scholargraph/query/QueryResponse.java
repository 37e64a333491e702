package org.scholargraph.query;

import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.Row;

import java.util.List;
import java.util.Map;

/**
 * Result of an ad-hoc query: the rows plus summary statistics derived from them.
 *
 * @param operation The operation that produced the rows.
 * @param result    The result table.
 * @param stats     Statistics computed by {@link ResultStatistics} from {@code result}.
 */
public record QueryResponse(QueryOperation operation, QueryResult result, Map<String, Object> stats) {

    public static QueryResponse of(QueryOperation operation, QueryResult result) {
        return new QueryResponse(operation, result, ResultStatistics.compute(operation, result));
    }

    public static QueryResponse empty(QueryOperation operation) {
        return of(operation, QueryResult.empty());
    }

    public List<Row> rows() {
        return result.rows();
    }

    public int rowCount() {
        return result.rowCount();
    }

    public boolean isEmpty() {
        return result.isEmpty();
    }
}

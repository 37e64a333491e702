package org.scholargraph.query;

import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.Row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary statistics of a query result, computed from the returned rows only.
 * <p>
 * SQL {@code NULL} values are skipped: sums ignore them and averages are taken over the
 * non-null values (0 if there are none). Row-valued statistics such as {@code top_field}
 * are {@code null} for an empty result.
 */
public final class ResultStatistics {

    private ResultStatistics() {
    }

    public static Map<String, Object> compute(QueryOperation operation, QueryResult result) {
        Map<String, Object> stats = new LinkedHashMap<>();
        switch (operation) {
            case PAPERS_BY_FIELD -> {
                stats.put("total_fields", result.rowCount());
                stats.put("total_papers", sum(result, "paper_count"));
                stats.put("top_field", result.isEmpty() ? null : result.rows().get(0).asMap());
            }
            case PAPERS_BY_YEAR -> {
                stats.put("total_years", result.rowCount());
                stats.put("total_papers", sum(result, "count"));
                stats.put("avg_per_year", mean(result, "count"));
                Row max = maxBy(result, "count");
                stats.put("max_year", max == null ? null : max.asMap());
            }
            case PAPERS_BY_CITATIONS -> {
                stats.put("total_papers", result.rowCount());
                stats.put("avg_citations", mean(result, "cited_by_count"));
                stats.put("max_citations", max(result, "cited_by_count"));
            }
            case PAPERS_BY_PATENTS -> {
                stats.put("total_papers", result.rowCount());
                stats.put("papers_with_patents", countPositive(result, "actual_patent_count"));
                stats.put("avg_patents", mean(result, "actual_patent_count"));
            }
            case ADVANCED, PAPERS -> {
                stats.put("total_papers", result.rowCount());
                stats.put("avg_citations", mean(result, "cited_by_count"));
            }
            case AVAILABLE_FIELDS -> {
                stats.put("total_fields", result.rowCount());
                stats.put("total_papers", sum(result, "paper_count"));
            }
            case AVAILABLE_YEARS -> {
                stats.put("total_years", result.rowCount());
                stats.put("total_papers", sum(result, "paper_count"));
            }
            case TOP_AUTHORS -> {
                stats.put("total_authors", result.rowCount());
                stats.put("top_author_papers", result.isEmpty() ? 0L : result.rows().get(0).getLong("paper_count", 0));
            }
            case FIELD_TRENDS -> {
                stats.put("total_years", result.rowCount());
                stats.put("avg_value", mean(result, "value"));
                Row peak = maxBy(result, "value");
                stats.put("peak_year", peak == null ? null : peak.get("year"));
            }
            case CITATION_PATTERNS -> stats.put("total_papers", sum(result, "paper_count"));
            case PATENT_DISTRIBUTION -> {
                long papers = sum(result, "paper_count");
                long withPatents = 0;
                double weighted = 0.0;
                for (Row row : result.rows()) {
                    long patents = row.getLong("patent_count", 0);
                    long count = row.getLong("paper_count", 0);
                    if (patents > 0) {
                        withPatents += count;
                    }
                    weighted += (double) patents * count;
                }
                stats.put("total_papers", papers);
                stats.put("papers_with_patents", withPatents);
                stats.put("avg_patents", papers > 0 ? weighted / papers : 0.0);
            }
        }
        return Collections.unmodifiableMap(stats);
    }

    static long sum(QueryResult result, String column) {
        long total = 0;
        for (Row row : result.rows()) {
            if (!row.isNull(column)) {
                total += row.getLong(column, 0);
            }
        }
        return total;
    }

    static double mean(QueryResult result, String column) {
        double total = 0.0;
        int count = 0;
        for (Row row : result.rows()) {
            if (!row.isNull(column)) {
                total += row.getDouble(column, 0.0);
                count++;
            }
        }
        return count == 0 ? 0.0 : total / count;
    }

    static long max(QueryResult result, String column) {
        Row row = maxBy(result, column);
        return row == null ? 0L : row.getLong(column, 0);
    }

    /**
     * @return The first row holding the largest non-null value, or null.
     */
    static Row maxBy(QueryResult result, String column) {
        Row best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Row row : result.rows()) {
            if (row.isNull(column)) {
                continue;
            }
            double value = row.getDouble(column, 0.0);
            if (best == null || value > bestValue) {
                best = row;
                bestValue = value;
            }
        }
        return best;
    }

    private static long countPositive(QueryResult result, String column) {
        long count = 0;
        for (Row row : result.rows()) {
            if (row.getLong(column, 0) > 0) {
                count++;
            }
        }
        return count;
    }
}

package org.scholargraph.query;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.Row;
import org.scholargraph.junit.extensions.logging.LogWatchExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ResultStatisticsTest {

    private static Row row(Object... keyValues) {
        Map<String, Object> values = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Row(values);
    }

    private static QueryResult result(List<String> columns, Row... rows) {
        return new QueryResult(columns, new ArrayList<>(List.of(rows)));
    }

    @Test
    void testCompute_AveragesSkipNulls() {
        QueryResult papers = result(List.of("paperid", "cited_by_count"),
            row("paperid", "P1", "cited_by_count", 10L),
            row("paperid", "P2", "cited_by_count", null),
            row("paperid", "P3", "cited_by_count", 20L));

        Map<String, Object> stats = ResultStatistics.compute(QueryOperation.PAPERS_BY_CITATIONS, papers);

        assertThat(stats)
            .containsEntry("total_papers", 3)
            .containsEntry("avg_citations", 15.0)
            .containsEntry("max_citations", 20L);
    }

    @Test
    void testCompute_EmptyResultHasNullRowStatistics() {
        Map<String, Object> byField = ResultStatistics.compute(QueryOperation.PAPERS_BY_FIELD, QueryResult.empty());
        Map<String, Object> trends = ResultStatistics.compute(QueryOperation.FIELD_TRENDS, QueryResult.empty());

        assertThat(byField).containsEntry("total_fields", 0).containsEntry("total_papers", 0L).containsEntry("top_field", null);
        assertThat(trends).containsEntry("avg_value", 0.0).containsEntry("peak_year", null);
    }

    @Test
    void testCompute_MaxYearIsFirstLargest() {
        QueryResult years = result(List.of("year", "count"),
            row("year", 2020, "count", 4L),
            row("year", 2021, "count", 7L),
            row("year", 2022, "count", 7L));

        Map<String, Object> stats = ResultStatistics.compute(QueryOperation.PAPERS_BY_YEAR, years);

        assertThat(stats).containsEntry("total_papers", 18L).containsEntry("avg_per_year", 6.0);
        assertThat(stats.get("max_year")).isEqualTo(Map.of("year", 2021, "count", 7L));
    }

    @Test
    void testCompute_PatentDistributionWeightsByPaperCount() {
        QueryResult distribution = result(List.of("patent_count", "paper_count"),
            row("patent_count", 0L, "paper_count", 6L),
            row("patent_count", 3L, "paper_count", 2L));

        Map<String, Object> stats = ResultStatistics.compute(QueryOperation.PATENT_DISTRIBUTION, distribution);

        assertThat(stats)
            .containsEntry("total_papers", 8L)
            .containsEntry("papers_with_patents", 2L)
            .containsEntry("avg_patents", 0.75);
    }

    @Test
    void testCompute_TopAuthorsReadsFirstRow() {
        QueryResult authors = result(List.of("authorid", "paper_count"),
            row("authorid", "A9", "paper_count", 12L),
            row("authorid", "A1", "paper_count", 3L));

        assertThat(ResultStatistics.compute(QueryOperation.TOP_AUTHORS, authors))
            .containsEntry("total_authors", 2)
            .containsEntry("top_author_papers", 12L);
    }

    @Test
    void testCompute_StatisticsAreImmutable() {
        Map<String, Object> stats = ResultStatistics.compute(QueryOperation.AVAILABLE_YEARS, QueryResult.empty());

        assertThatThrownBy(() -> stats.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}

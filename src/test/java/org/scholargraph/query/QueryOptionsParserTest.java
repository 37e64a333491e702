package org.scholargraph.query;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.scholargraph.junit.extensions.logging.LogWatchExtension;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class QueryOptionsParserTest {

    @Test
    void testParse_NullOrEmptyGivesDefaults() {
        QueryOptions options = QueryOptionsParser.parse(null);

        assertThat(options.field()).isEmpty();
        assertThat(options.limit()).isEmpty();
        assertThat(options.metric()).isEqualTo(TrendMetric.COUNT);
        assertThat(QueryOptionsParser.parse(Map.of()).hasPatents()).isFalse();
    }

    @Test
    void testParse_AcceptsAliasesAndNumericStrings() {
        QueryOptions options = QueryOptionsParser.parse(Map.of(
            "field_filter", "learning",
            "lookback_years", "3",
            "min_citations", 10L,
            "max_citations", 50.0,
            "has_patents", "TRUE",
            "metric", "citations"));

        assertThat(options.field()).contains("learning");
        assertThat(options.lookbackYears()).hasValue(3);
        assertThat(options.minCitations()).hasValue(10);
        assertThat(options.maxCitations()).hasValue(50);
        assertThat(options.hasPatents()).isTrue();
        assertThat(options.metric()).isEqualTo(TrendMetric.CITATIONS);
    }

    @Test
    void testParse_YearRangeSetsBothBounds() {
        QueryOptions options = QueryOptionsParser.parse(Map.of("year_range", List.of(2019, 2022)));

        assertThat(options.startYear()).hasValue(2019);
        assertThat(options.endYear()).hasValue(2022);
    }

    @Test
    void testParse_SingleValuesBecomeLists() {
        QueryOptions options = QueryOptionsParser.parse(Map.of(
            "author_id", "A1",
            "fields", "Biology"));

        assertThat(options.authorIds()).containsExactly("A1");
        assertThat(options.fields()).containsExactly("Biology");
    }

    @Test
    void testParse_NullValuesAreAbsent() {
        Map<String, Object> params = new HashMap<>();
        params.put("year", null);
        params.put("author_ids", Arrays.asList("A1", null, "A2"));

        QueryOptions options = QueryOptionsParser.parse(params);

        assertThat(options.year()).isEmpty();
        assertThat(options.authorIds()).containsExactly("A1", "A2");
    }

    @Test
    void testParse_NonPositiveLimitMeansUnlimited() {
        assertThat(QueryOptionsParser.parse(Map.of("limit", 0)).limit()).isEmpty();
        assertThat(QueryOptionsParser.parse(Map.of("limit", -5)).limit()).isEmpty();
        assertThat(QueryOptionsParser.parse(Map.of("limit", 25)).limit()).hasValue(25);
    }

    @Test
    void testParse_UnknownMetricFallsBackToCount() {
        assertThat(QueryOptionsParser.parse(Map.of("metric", "h-index")).metric()).isEqualTo(TrendMetric.COUNT);
    }

    @Test
    void testParse_RejectsWrongTypes() {
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("year", "soon")))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("year");
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("limit", 2.5)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("has_patents", "maybe")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("year_range", List.of(2020))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("field", List.of("a"))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("year", 3_000_000_000L)))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("out of range");
    }

    @Test
    void testParse_RejectsInvertedRanges() {
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("start_year", 2024, "end_year", 2020)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryOptionsParser.parse(Map.of("min_citations", 9, "max_citations", 1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testOperationNames_ResolveBothForms() {
        assertThat(QueryOperation.fromName("explore_top_authors")).isEqualTo(QueryOperation.TOP_AUTHORS);
        assertThat(QueryOperation.fromName("field_trends")).isEqualTo(QueryOperation.FIELD_TRENDS);
        assertThatThrownBy(() -> QueryOperation.fromName("drop_tables")).isInstanceOf(IllegalArgumentException.class);
    }
}

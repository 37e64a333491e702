package org.scholargraph.query;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.scholargraph.api.resources.store.CorpusTable;
import org.scholargraph.api.resources.store.Row;
import org.scholargraph.api.resources.store.StoreUnavailableException;
import org.scholargraph.junit.extensions.logging.LogWatchExtension;
import org.scholargraph.resources.store.DuckDbColumnarStore;
import org.scholargraph.testutils.CorpusFixture;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CorpusQueryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private DuckDbColumnarStore store;
    private CorpusQueryService service;

    /**
     * Five papers across two learning fields, biology and computer science. P1 belongs to both
     * learning fields, P4 has no citation count.
     */
    private static CorpusFixture corpus() {
        return CorpusFixture.create()
            .field("F_ML", "Machine learning")
            .field("F_DL", "Deep learning")
            .field("F_BIO", "Biology")
            .field("F_CHEM", "Chemistry")
            .paper("P1", 2020, "article", false, 120, 2)
            .paper("P2", 2021, "article", false, 30, 0)
            .paper("P3", 2022, "article", false, 0, 1)
            .paper("P4", 2023, "preprint", false, null, 0)
            .paper("P5", 2023, "article", false, 75, 0)
            .paperField("P1", "F_ML")
            .paperField("P1", "F_DL")
            .paperField("P2", "F_ML")
            .paperField("P3", "F_BIO")
            .paperField("P4", CorpusFixture.FIELD)
            .paperField("P5", "F_DL")
            .authorship("P1", "A1", CorpusFixture.INSTITUTION, "first")
            .authorship("P1", "A2", CorpusFixture.INSTITUTION, "last")
            .authorship("P2", "A1", CorpusFixture.INSTITUTION, "first")
            .authorship("P3", "A3", "I_OTHER", "first")
            .authorship("P4", "A1", CorpusFixture.INSTITUTION, "first")
            .authorship("P5", "A2", CorpusFixture.INSTITUTION, "first")
            .authorship("P5", null, CorpusFixture.INSTITUTION, "last")
            .patentLink("P1", "US1")
            .patentLink("P1", "US2")
            .patentLink("P3", "EP1");
    }

    @BeforeEach
    void setUp() throws Exception {
        Path data = corpus().writeTo(tempDir.resolve("sample"));
        store = new DuckDbColumnarStore("sample-store", CorpusFixture.storeConfig(data));
        service = new CorpusQueryService(store, CLOCK);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static List<String> column(QueryResponse response, String column) {
        return response.rows().stream().map(row -> String.valueOf(row.get(column))).toList();
    }

    @Test
    void testPapersByField_CountsEachPaperOncePerField() throws Exception {
        QueryResponse response = service.papersByField(QueryOptions.none());

        assertThat(column(response, "display_name"))
            .containsExactly("Deep learning", "Machine learning", "Computer science", "Biology");
        assertThat(column(response, "paper_count")).containsExactly("2", "2", "1", "1");
        assertThat(response.stats()).containsEntry("total_fields", 4).containsEntry("total_papers", 6L);
    }

    @Test
    void testPapersByField_SubstringIsCaseInsensitive() throws Exception {
        QueryResponse response = service.papersByField(QueryOptions.builder().field("LEARN").limit(1).build());

        assertThat(response.rowCount()).isEqualTo(1);
        assertThat(response.rows().get(0).getString("fieldid")).isEqualTo("F_DL");
    }

    @Test
    void testPapersByYear_LookbackIsRelativeToClock() throws Exception {
        QueryResponse all = service.papersByYear(QueryOptions.none());
        QueryResponse recent = service.papersByYear(QueryOptions.builder().lookbackYears(2).build());

        assertThat(column(all, "year")).containsExactly("2020", "2021", "2022", "2023");
        assertThat(all.stats()).containsEntry("total_papers", 5L).containsEntry("avg_per_year", 1.25);
        assertThat(column(recent, "year")).containsExactly("2022", "2023");
        @SuppressWarnings("unchecked")
        Map<String, Object> maxYear = (Map<String, Object>) recent.stats().get("max_year");
        assertThat(maxYear).containsEntry("year", 2023);
    }

    @Test
    void testPapersByCitations_FieldFilterDoesNotDuplicatePapers() throws Exception {
        QueryResponse response = service.papersByCitations(QueryOptions.builder().field("learning").build());

        assertThat(column(response, "paperid")).containsExactly("P1", "P5", "P2");
        assertThat(response.rows().get(0).getLong("field_count", 0)).isEqualTo(2);
        assertThat(response.stats()).containsEntry("max_citations", 120L).containsEntry("total_papers", 3);
    }

    @Test
    void testPapersByCitations_RangeAndYear() throws Exception {
        QueryResponse response = service.papersByCitations(QueryOptions.builder()
            .minCitations(10).maxCitations(100).year(2023).build());

        assertThat(column(response, "paperid")).containsExactly("P5");
    }

    @Test
    void testPapersByPatents_CountsLinks() throws Exception {
        QueryResponse response = service.papersByPatents(QueryOptions.builder().hasPatents(true).build());

        assertThat(column(response, "paperid")).containsExactly("P1", "P3");
        assertThat(column(response, "actual_patent_count")).containsExactly("2", "1");
        assertThat(response.stats()).containsEntry("papers_with_patents", 2L).containsEntry("avg_patents", 1.5);
    }

    @Test
    void testAdvancedQuery_CombinesFieldAndYearRange() throws Exception {
        QueryResponse response = service.advancedQuery(QueryOptions.builder()
            .field("learning").startYear(2021).build());

        assertThat(column(response, "paperid")).containsExactly("P5", "P2");
    }

    @Test
    void testAdvancedQuery_FieldAlternativesAreOred() throws Exception {
        QueryResponse response = service.advancedQuery(QueryOptions.builder()
            .field("deep").fields(List.of("Biology")).build());

        assertThat(column(response, "paperid")).containsExactly("P1", "P5", "P3");
    }

    @Test
    void testAdvancedQuery_AuthorsAndCitations() throws Exception {
        QueryResponse response = service.advancedQuery(QueryOptions.builder()
            .authorIds(List.of("A1", "A3")).minCitations(10).build());

        assertThat(column(response, "paperid")).containsExactly("P1", "P2");
        assertThat(response.stats()).containsEntry("total_papers", 2).containsEntry("avg_citations", 75.0);
    }

    @Test
    void testAdvancedQuery_UnknownFieldYieldsEmptyResult() throws Exception {
        QueryResponse response = service.advancedQuery(QueryOptions.builder().fields(List.of("Astrology")).build());

        assertThat(response.isEmpty()).isTrue();
        assertThat(response.stats()).containsEntry("total_papers", 0).containsEntry("avg_citations", 0.0);
    }

    @Test
    void testAvailableFields_OmitsFieldsWithoutPapers() throws Exception {
        QueryResponse response = service.availableFields();

        assertThat(column(response, "fieldid")).doesNotContain("F_CHEM").hasSize(4);
    }

    @Test
    void testAvailableYears_CountsPapersPerYear() throws Exception {
        QueryResponse response = service.availableYears();

        assertThat(column(response, "paper_count")).containsExactly("1", "1", "1", "2");
        assertThat(response.stats()).containsEntry("total_years", 4).containsEntry("total_papers", 5L);
    }

    @Test
    void testTopAuthors_RanksByDistinctPapers() throws Exception {
        QueryResponse all = service.topAuthors(QueryOptions.none());
        QueryResponse prolific = service.topAuthors(QueryOptions.builder().minPapers(2).build());
        QueryResponse learning = service.topAuthors(QueryOptions.builder().field("learning").limit(1).build());

        assertThat(column(all, "authorid")).containsExactly("A1", "A2", "A3");
        assertThat(all.stats()).containsEntry("top_author_papers", 3L);
        assertThat(column(prolific, "authorid")).containsExactly("A1", "A2");
        assertThat(column(learning, "authorid")).containsExactly("A1");
    }

    @Test
    void testTrendOverTime_AverageCitationsPerYear() throws Exception {
        QueryResponse response = service.trendOverTime(QueryOptions.builder()
            .field("learning").metric(TrendMetric.CITATIONS).build());

        assertThat(column(response, "year")).containsExactly("2020", "2021", "2023");
        assertThat(response.rows().get(2).getDouble("value", 0)).isEqualTo(75.0);
        assertThat(response.stats()).containsEntry("peak_year", 2020);
    }

    @Test
    void testTrendOverTime_CountWithinYearRange() throws Exception {
        QueryResponse response = service.trendOverTime(QueryOptions.builder().yearRange(2022, 2023).build());

        assertThat(column(response, "value")).containsExactly("1", "2");
    }

    @Test
    void testCitationPatterns_BucketsInRangeOrder() throws Exception {
        QueryResponse response = service.citationPatterns(QueryOptions.none());

        assertThat(column(response, "citation_range")).containsExactly("0", "11-50", "51-100", "100+");
        assertThat(column(response, "paper_count")).containsExactly("2", "1", "1", "1");
        assertThat(response.stats()).containsEntry("total_papers", 5L);
    }

    @Test
    void testPatentDistribution_GroupsByLinkCount() throws Exception {
        QueryResponse response = service.patentDistribution(QueryOptions.none());

        assertThat(column(response, "patent_count")).containsExactly("0", "1", "2");
        assertThat(column(response, "paper_count")).containsExactly("3", "1", "1");
        assertThat(response.stats())
            .containsEntry("total_papers", 5L)
            .containsEntry("papers_with_patents", 2L)
            .containsEntry("avg_patents", 0.6);
    }

    @Test
    void testExecute_ParsesLooseParameters() throws Exception {
        Map<String, Object> params = new HashMap<>();
        params.put("field_name", "learning");
        params.put("limit", "1");
        params.put("unrelated", true);

        QueryResponse response = service.execute(QueryOperation.fromName("query_papers_by_citations"), params);

        assertThat(column(response, "paperid")).containsExactly("P1");
    }

    @Test
    void testExecute_MalformedParametersYieldEmptyResponse() throws Exception {
        QueryResponse badYear = service.execute(QueryOperation.PAPERS, Map.of("year", "recent"));
        QueryResponse inverted = service.execute(QueryOperation.ADVANCED, Map.of("start_year", 2023, "end_year", 2020));

        assertThat(badYear.isEmpty()).isTrue();
        assertThat(badYear.operation()).isEqualTo(QueryOperation.PAPERS);
        assertThat(inverted.isEmpty()).isTrue();
    }

    @Test
    void testTypedOptions_InvertedRangesYieldEmptyTables() throws Exception {
        QueryOptions years = QueryOptions.builder().yearRange(2023, 2020).build();
        QueryOptions citations = QueryOptions.builder().minCitations(100).maxCitations(10).build();

        assertThat(years.hasInvertedRange()).isTrue();
        assertThat(citations.hasInvertedRange()).isTrue();
        assertThat(service.papers(years).isEmpty()).isTrue();
        assertThat(service.papersByYear(years).isEmpty()).isTrue();
        assertThat(service.advancedQuery(years).isEmpty()).isTrue();
        assertThat(service.trendOverTime(years).isEmpty()).isTrue();
        assertThat(service.papersByCitations(citations).isEmpty()).isTrue();
        assertThat(service.advancedQuery(citations).isEmpty()).isTrue();
    }

    @Test
    void testPapers_ListsMatchingPapersInIdOrder() throws Exception {
        QueryResponse response = service.execute(QueryOperation.PAPERS, QueryOptions.builder().minPatents(1).build());

        assertThat(column(response, "paperid")).containsExactly("P1", "P3");
    }

    @Test
    void testPapersByPatents_MissingLinkTableIsUnavailable() throws Exception {
        Path data = corpus().without(CorpusTable.PATENT_LINKS).writeTo(tempDir.resolve("no-patents"));
        try (DuckDbColumnarStore bare = new DuckDbColumnarStore("bare", CorpusFixture.storeConfig(data))) {
            CorpusQueryService bareService = new CorpusQueryService(bare, CLOCK);

            assertThatThrownBy(() -> bareService.papersByPatents(QueryOptions.none()))
                .isInstanceOf(StoreUnavailableException.class);
            assertThat(bareService.papers(QueryOptions.none()).rowCount()).isEqualTo(5);
        }
    }

    @Test
    void testRows_KeepSqlNulls() throws Exception {
        Row p4 = service.papers(QueryOptions.builder().year(2023).build()).rows().stream()
            .filter(row -> "P4".equals(row.getString("paperid")))
            .findFirst()
            .orElseThrow();

        assertThat(p4.isNull("cited_by_count")).isTrue();
    }
}

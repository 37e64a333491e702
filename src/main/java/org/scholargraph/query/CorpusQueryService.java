package org.scholargraph.query;

import org.scholargraph.api.resources.store.CorpusTable;
import org.scholargraph.api.resources.store.IColumnarStore;
import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.StoreException;
import org.scholargraph.query.sql.SelectQuery;
import org.scholargraph.query.sql.SqlPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.scholargraph.query.sql.Predicates.eq;
import static org.scholargraph.query.sql.Predicates.ge;
import static org.scholargraph.query.sql.Predicates.gt;
import static org.scholargraph.query.sql.Predicates.ilike;
import static org.scholargraph.query.sql.Predicates.in;
import static org.scholargraph.query.sql.Predicates.isNotNull;
import static org.scholargraph.query.sql.Predicates.le;
import static org.scholargraph.query.sql.Predicates.or;

/**
 * Parameterized aggregation queries over a columnar store, independent of the fixed filter
 * criteria.
 * <p>
 * Field-name filters are applied as semi-joins on the paper id so that a paper with several
 * matching field assignments is counted once. Unknown field names and other predicates that
 * match nothing produce empty results; only store failures are thrown.
 */
public class CorpusQueryService {

    private static final Logger log = LoggerFactory.getLogger(CorpusQueryService.class);

    private static final String PAPER_COLUMNS =
        "p.paperid, p.year, p.doctype, p.is_retracted, p.cited_by_count, p.patent_count";

    private final IColumnarStore store;
    private final Clock clock;

    public CorpusQueryService(IColumnarStore store) {
        this(store, Clock.systemDefaultZone());
    }

    public CorpusQueryService(IColumnarStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs an operation with loosely typed parameters. Parameters of the wrong type yield an
     * empty response instead of an exception.
     *
     * @param operation The operation.
     * @param params    Parameters as described in {@link QueryOptionsParser}.
     * @return The response.
     * @throws StoreException if the store cannot answer the query.
     */
    public QueryResponse execute(QueryOperation operation, Map<String, ?> params) throws StoreException {
        QueryOptions options;
        try {
            options = QueryOptionsParser.parse(params);
        } catch (IllegalArgumentException e) {
            log.info("Malformed parameters for {}, returning an empty result: {}", operation.toolName(), e.getMessage());
            return QueryResponse.empty(operation);
        }
        return execute(operation, options);
    }

    public QueryResponse execute(QueryOperation operation, QueryOptions options) throws StoreException {
        return switch (operation) {
            case PAPERS -> papers(options);
            case PAPERS_BY_FIELD -> papersByField(options);
            case PAPERS_BY_YEAR -> papersByYear(options);
            case PAPERS_BY_CITATIONS -> papersByCitations(options);
            case PAPERS_BY_PATENTS -> papersByPatents(options);
            case ADVANCED -> advancedQuery(options);
            case AVAILABLE_FIELDS -> availableFields();
            case AVAILABLE_YEARS -> availableYears();
            case TOP_AUTHORS -> topAuthors(options);
            case FIELD_TRENDS -> trendOverTime(options);
            case CITATION_PATTERNS -> citationPatterns(options);
            case PATENT_DISTRIBUTION -> patentDistribution(options);
        };
    }

    /**
     * Plain paper listing. Options: year, start/end year, min/max citations, min patents,
     * has patents, limit.
     */
    public QueryResponse papers(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select("p.*")
            .from(store.tableSource(CorpusTable.PAPERS), "p");
        yearPredicates(options).forEach(query::where);
        citationPredicates(options).forEach(query::where);
        options.minPatents().ifPresent(min -> query.where(ge("p.patent_count", min)));
        if (options.hasPatents()) {
            query.where(gt("p.patent_count", 0));
        }
        query.orderBy("p.paperid").limit(limitOf(options));
        return run(QueryOperation.PAPERS, query);
    }

    /**
     * Paper count per field, largest first. Options: field (substring of the display name), limit.
     */
    public QueryResponse papersByField(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select("pf.fieldid", "f.display_name", "COUNT(DISTINCT pf.paperid) AS paper_count")
            .from(store.tableSource(CorpusTable.PAPER_FIELDS), "pf")
            .leftJoin(store.tableSource(CorpusTable.FIELDS), "f", "pf.fieldid = f.fieldid");
        options.field().ifPresent(field -> query.where(ilike("f.display_name", field)));
        query.groupBy("pf.fieldid", "f.display_name")
            .orderBy("paper_count DESC", "pf.fieldid")
            .limit(limitOf(options));
        return run(QueryOperation.PAPERS_BY_FIELD, query);
    }

    /**
     * Paper count per year, ascending. Options: year, start/end year, lookback years.
     */
    public QueryResponse papersByYear(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select("p.year", "COUNT(*) AS count")
            .from(store.tableSource(CorpusTable.PAPERS), "p");
        yearPredicates(options).forEach(query::where);
        options.lookbackYears().ifPresent(years -> query.where(ge("p.year", currentYear() - years)));
        query.groupBy("p.year").orderBy("p.year");
        return run(QueryOperation.PAPERS_BY_YEAR, query);
    }

    /**
     * Papers by citation count, most cited first, one row per paper with its number of field
     * assignments. Options: min/max citations, year, field, limit.
     */
    public QueryResponse papersByCitations(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select(PAPER_COLUMNS, "COUNT(DISTINCT pf.fieldid) AS field_count")
            .from(store.tableSource(CorpusTable.PAPERS), "p")
            .leftJoin(store.tableSource(CorpusTable.PAPER_FIELDS), "pf", "p.paperid = pf.paperid");
        citationPredicates(options).forEach(query::where);
        options.year().ifPresent(year -> query.where(eq("p.year", year)));
        if (options.field().isPresent()) {
            query.where(in("p.paperid", papersInField(options.field().get())));
        }
        query.groupBy(PAPER_COLUMNS)
            .orderBy("p.cited_by_count DESC", "p.paperid")
            .limit(limitOf(options));
        return run(QueryOperation.PAPERS_BY_CITATIONS, query);
    }

    /**
     * Papers by number of patent links, most linked first. Options: min patents, has
     * patents, year, limit.
     */
    public QueryResponse papersByPatents(QueryOptions options) throws StoreException {
        String linkCount = "COALESCE(pat.link_count, 0)";
        SelectQuery query = SelectQuery.select("p.*", linkCount + " AS actual_patent_count")
            .from(store.tableSource(CorpusTable.PAPERS), "p")
            .leftJoin(patentLinkCounts(), "pat", "p.paperid = pat.paperid");
        options.minPatents().ifPresent(min -> query.where(ge(linkCount, min)));
        if (options.hasPatents()) {
            query.where(gt(linkCount, 0));
        }
        options.year().ifPresent(year -> query.where(eq("p.year", year)));
        query.orderBy("actual_patent_count DESC", "p.paperid").limit(limitOf(options));
        return run(QueryOperation.PAPERS_BY_PATENTS, query);
    }

    /**
     * Multi-predicate search. Field substring and exact field names are alternatives, as are
     * the author ids; every other predicate must hold as well. Field and author groups are
     * semi-joins, so each paper appears at most once. Most cited first.
     */
    public QueryResponse advancedQuery(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select("p.*")
            .from(store.tableSource(CorpusTable.PAPERS), "p");

        List<SqlPredicate> fieldAlternatives = new ArrayList<>();
        options.field().ifPresent(field -> fieldAlternatives.add(ilike("f.display_name", field)));
        if (!options.fields().isEmpty()) {
            fieldAlternatives.add(in("f.display_name", options.fields()));
        }
        if (!fieldAlternatives.isEmpty()) {
            query.where(in("p.paperid", fieldPapers(or(fieldAlternatives))));
        }
        if (!options.authorIds().isEmpty()) {
            query.where(in("p.paperid", SelectQuery.select("paa.paperid")
                .from(store.tableSource(CorpusTable.AUTHORSHIPS), "paa")
                .where(in("paa.authorid", options.authorIds()))));
        }
        yearPredicates(options).forEach(query::where);
        citationPredicates(options).forEach(query::where);
        options.minPatents().ifPresent(min -> query.where(ge("p.patent_count", min)));
        if (options.hasPatents()) {
            query.where(gt("p.patent_count", 0));
        }
        query.orderBy("p.cited_by_count DESC", "p.paperid").limit(limitOf(options));
        return run(QueryOperation.ADVANCED, query);
    }

    /**
     * Fields with at least one paper, largest first.
     */
    public QueryResponse availableFields() throws StoreException {
        SelectQuery query = SelectQuery.select("f.fieldid", "f.display_name", "COUNT(DISTINCT pf.paperid) AS paper_count")
            .from(store.tableSource(CorpusTable.FIELDS), "f")
            .leftJoin(store.tableSource(CorpusTable.PAPER_FIELDS), "pf", "f.fieldid = pf.fieldid")
            .groupBy("f.fieldid", "f.display_name")
            .having(gt("COUNT(DISTINCT pf.paperid)", 0))
            .orderBy("paper_count DESC", "f.fieldid");
        return run(QueryOperation.AVAILABLE_FIELDS, query);
    }

    /**
     * Paper count for every year present.
     */
    public QueryResponse availableYears() throws StoreException {
        SelectQuery query = SelectQuery.select("p.year", "COUNT(*) AS paper_count")
            .from(store.tableSource(CorpusTable.PAPERS), "p")
            .groupBy("p.year")
            .orderBy("p.year");
        return run(QueryOperation.AVAILABLE_YEARS, query);
    }

    /**
     * Authors with the most papers. Options: limit (default 10), min papers, field.
     */
    public QueryResponse topAuthors(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select("paa.authorid", "COUNT(DISTINCT paa.paperid) AS paper_count")
            .from(store.tableSource(CorpusTable.AUTHORSHIPS), "paa")
            .where(isNotNull("paa.authorid"));
        if (options.field().isPresent()) {
            query.where(in("paa.paperid", papersInField(options.field().get())));
        }
        query.groupBy("paa.authorid");
        options.minPapers().ifPresent(min -> query.having(ge("COUNT(DISTINCT paa.paperid)", min)));
        query.orderBy("paper_count DESC", "paa.authorid")
            .limit(options.limit().orElse(10));
        return run(QueryOperation.TOP_AUTHORS, query);
    }

    /**
     * Per-year paper count, average citations or average patents. Options: metric, field,
     * start/end year.
     */
    public QueryResponse trendOverTime(QueryOptions options) throws StoreException {
        SelectQuery query = SelectQuery.select("p.year", options.metric().aggregate() + " AS value")
            .from(store.tableSource(CorpusTable.PAPERS), "p");
        if (options.field().isPresent()) {
            query.where(in("p.paperid", papersInField(options.field().get())));
        }
        options.startYear().ifPresent(start -> query.where(ge("p.year", start)));
        options.endYear().ifPresent(end -> query.where(le("p.year", end)));
        query.groupBy("p.year").orderBy("p.year");
        return run(QueryOperation.FIELD_TRENDS, query);
    }

    /**
     * Paper count per citation bucket (0, 1-10, 11-50, 51-100, 100+), in bucket order.
     * Missing citation counts count as 0. Options: year, field, min citations.
     */
    public QueryResponse citationPatterns(QueryOptions options) throws StoreException {
        String citations = "COALESCE(p.cited_by_count, 0)";
        String bucket = "CASE"
            + " WHEN " + citations + " = 0 THEN '0'"
            + " WHEN " + citations + " BETWEEN 1 AND 10 THEN '1-10'"
            + " WHEN " + citations + " BETWEEN 11 AND 50 THEN '11-50'"
            + " WHEN " + citations + " BETWEEN 51 AND 100 THEN '51-100'"
            + " ELSE '100+' END";
        SelectQuery query = SelectQuery.select(bucket + " AS citation_range", "COUNT(*) AS paper_count")
            .from(store.tableSource(CorpusTable.PAPERS), "p");
        options.year().ifPresent(year -> query.where(eq("p.year", year)));
        options.minCitations().ifPresent(min -> query.where(ge(citations, min)));
        if (options.field().isPresent()) {
            query.where(in("p.paperid", papersInField(options.field().get())));
        }
        query.groupBy("citation_range").orderBy("MIN(" + citations + ")");
        return run(QueryOperation.CITATION_PATTERNS, query);
    }

    /**
     * Paper count per exact number of patent links, ascending. Options: year, field.
     */
    public QueryResponse patentDistribution(QueryOptions options) throws StoreException {
        String linkCount = "COALESCE(pat.link_count, 0)";
        SelectQuery query = SelectQuery.select(linkCount + " AS patent_count", "COUNT(*) AS paper_count")
            .from(store.tableSource(CorpusTable.PAPERS), "p")
            .leftJoin(patentLinkCounts(), "pat", "p.paperid = pat.paperid");
        options.year().ifPresent(year -> query.where(eq("p.year", year)));
        if (options.field().isPresent()) {
            query.where(in("p.paperid", papersInField(options.field().get())));
        }
        query.groupBy(linkCount).orderBy("patent_count");
        return run(QueryOperation.PATENT_DISTRIBUTION, query);
    }

    private QueryResponse run(QueryOperation operation, SelectQuery query) throws StoreException {
        long start = System.currentTimeMillis();
        QueryResult result = store.run(query.toSql());
        log.debug("{} returned {} rows in {} ms", operation.toolName(), result.rowCount(), System.currentTimeMillis() - start);
        return QueryResponse.of(operation, result);
    }

    private SelectQuery papersInField(String fieldSubstring) throws StoreException {
        return fieldPapers(ilike("f.display_name", fieldSubstring));
    }

    private SelectQuery fieldPapers(SqlPredicate fieldPredicate) throws StoreException {
        return SelectQuery.select("pf.paperid")
            .from(store.tableSource(CorpusTable.PAPER_FIELDS), "pf")
            .join(store.tableSource(CorpusTable.FIELDS), "f", "pf.fieldid = f.fieldid")
            .where(fieldPredicate);
    }

    private SelectQuery patentLinkCounts() throws StoreException {
        return SelectQuery.select("paperid", "COUNT(*) AS link_count")
            .from(store.tableSource(CorpusTable.PATENT_LINKS), "l")
            .groupBy("paperid");
    }

    private static List<SqlPredicate> yearPredicates(QueryOptions options) {
        List<SqlPredicate> predicates = new ArrayList<>();
        options.year().ifPresent(year -> predicates.add(eq("p.year", year)));
        options.startYear().ifPresent(start -> predicates.add(ge("p.year", start)));
        options.endYear().ifPresent(end -> predicates.add(le("p.year", end)));
        return predicates;
    }

    private static List<SqlPredicate> citationPredicates(QueryOptions options) {
        List<SqlPredicate> predicates = new ArrayList<>();
        options.minCitations().ifPresent(min -> predicates.add(ge("p.cited_by_count", min)));
        options.maxCitations().ifPresent(max -> predicates.add(le("p.cited_by_count", max)));
        return predicates;
    }

    private static Integer limitOf(QueryOptions options) {
        return options.limit().isPresent() ? options.limit().getAsInt() : null;
    }

    private int currentYear() {
        return Year.now(clock).getValue();
    }
}

package org.scholargraph.filter;

import com.typesafe.config.Config;
import org.scholargraph.api.model.FilterCriteria;
import org.scholargraph.api.model.Paper;
import org.scholargraph.api.model.PaperTable;
import org.scholargraph.api.resources.cache.ArtifactKind;
import org.scholargraph.api.resources.cache.CacheKey;
import org.scholargraph.api.resources.cache.CacheReadResult;
import org.scholargraph.api.resources.cache.IArtifactCache;
import org.scholargraph.api.resources.store.CorpusTable;
import org.scholargraph.api.resources.store.IColumnarStore;
import org.scholargraph.api.resources.store.QueryResult;
import org.scholargraph.api.resources.store.Row;
import org.scholargraph.api.resources.store.SchemaException;
import org.scholargraph.api.resources.store.StoreException;
import org.scholargraph.utils.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies the fixed {@link FilterCriteria} to the corpus and memoizes the result per
 * lookback window.
 * <p>
 * Lookups go through three levels: the in-process maps of this instance, the
 * {@link IArtifactCache} (only entries tagged with this instance's filter signature), and
 * finally the store. Computed results are written back to the disk cache on a best-effort
 * basis.
 * <p>
 * All public operations hold one {@link ReentrantLock}; {@link #filteredPapers(int)} calls
 * {@link #filteredPaperIds(int)} while holding it.
 * <p>
 * Configuration ({@code filter} block):
 * <ul>
 *   <li>{@code institutionId}, {@code fieldId}, {@code doctype}, {@code excludeRetracted},
 *       {@code authorPosition}: see {@link FilterCriteria#fromConfig(Config)}</li>
 *   <li>{@code streamingThresholdYears} (default 10): windows at least this long are
 *       computed through an intermediate Parquet file</li>
 *   <li>{@code chunkSize} (default 50000): ids read back per chunk on the streaming path</li>
 * </ul>
 */
public class CorpusFilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(CorpusFilterPipeline.class);
    private static final String ID_TABLE = "filtered_ids";

    private final IColumnarStore store;
    private final IArtifactCache cache;
    private final FilterCriteria criteria;
    private final String signature;
    private final Clock clock;
    private final int streamingThresholdYears;
    private final int chunkSize;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, Set<String>> paperIdsByWindow = new HashMap<>();
    private final Map<Integer, PaperTable> papersByWindow = new HashMap<>();

    public CorpusFilterPipeline(IColumnarStore store, IArtifactCache cache, Config options) {
        this(store, cache, options, Clock.systemDefaultZone());
    }

    public CorpusFilterPipeline(IColumnarStore store, IArtifactCache cache, Config options, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.criteria = FilterCriteria.fromConfig(options);
        this.signature = criteria.signature();
        this.streamingThresholdYears = options.hasPath("streamingThresholdYears")
            ? options.getInt("streamingThresholdYears") : 10;
        this.chunkSize = options.hasPath("chunkSize") ? options.getInt("chunkSize") : 50_000;
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }
        log.debug("Filter pipeline created for {} (signature {})", criteria.describe(), signature);
    }

    public FilterCriteria criteria() {
        return criteria;
    }

    public String signature() {
        return signature;
    }

    /**
     * Returns the ids of all papers matching the filter criteria within the last
     * {@code lookbackYears} years (inclusive of the current year).
     *
     * @param lookbackYears The window length, at least 0.
     * @return An unmodifiable set of paper ids, ordered by id.
     * @throws StoreException if the store cannot answer the query.
     */
    public Set<String> filteredPaperIds(int lookbackYears) throws StoreException {
        requireWindow(lookbackYears);
        lock.lock();
        try {
            Set<String> memoized = paperIdsByWindow.get(lookbackYears);
            if (memoized != null) {
                return memoized;
            }

            CacheKey key = new CacheKey(ArtifactKind.PAPER_IDS, lookbackYears, signature);
            CacheReadResult cached = cache.read(key);
            if (cached.isHit()) {
                Set<String> ids = idsOf(cached.rows());
                paperIdsByWindow.put(lookbackYears, ids);
                log.debug("Adopted {} cached paper ids for {} year window", ids.size(), lookbackYears);
                return ids;
            }

            long start = System.currentTimeMillis();
            String sql = paperIdQuery(lookbackYears);
            Set<String> ids = lookbackYears >= streamingThresholdYears
                ? streamPaperIds(sql, lookbackYears)
                : idsOf(store.run(sql));
            paperIdsByWindow.put(lookbackYears, ids);
            log.info("Filtered {} papers for {} year window in {} ms",
                ids.size(), lookbackYears, System.currentTimeMillis() - start);

            persist(key, toIdResult(ids));
            return ids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the attribute table of the filtered papers.
     *
     * @param lookbackYears The window length, at least 0.
     * @return The papers; empty when the filter matches nothing.
     * @throws SchemaException if the papers table has no {@code year} column.
     * @throws StoreException  if the store cannot answer the query.
     */
    public PaperTable filteredPapers(int lookbackYears) throws StoreException {
        requireWindow(lookbackYears);
        lock.lock();
        try {
            PaperTable memoized = papersByWindow.get(lookbackYears);
            if (memoized != null) {
                return memoized;
            }

            CacheKey key = new CacheKey(ArtifactKind.PAPER_TABLE, lookbackYears, signature);
            CacheReadResult cached = cache.read(key);
            if (cached.isHit() && cached.rows().hasColumn("year")) {
                PaperTable table = toPaperTable(lookbackYears, cached.rows());
                papersByWindow.put(lookbackYears, table);
                log.debug("Adopted {} cached papers for {} year window", table.size(), lookbackYears);
                return table;
            }

            Set<String> ids = filteredPaperIds(lookbackYears);
            if (ids.isEmpty()) {
                log.info("No papers match {} in the last {} years", criteria.describe(), lookbackYears);
                return PaperTable.empty(lookbackYears, signature);
            }

            String sql = "SELECT p.* FROM " + store.tableSource(CorpusTable.PAPERS) + " p"
                + " WHERE p.paperid IN (SELECT id FROM " + ID_TABLE + ")"
                + " ORDER BY p.paperid";
            QueryResult result = store.run(sql, Map.of(ID_TABLE, ids));
            if (result.isEmpty()) {
                return PaperTable.empty(lookbackYears, signature);
            }
            if (!result.hasColumn("year")) {
                log.error("Papers table has no 'year' column; columns are {}", result.columns());
                throw new SchemaException("Papers table is missing required column 'year'", "year");
            }

            PaperTable table = toPaperTable(lookbackYears, result);
            papersByWindow.put(lookbackYears, table);
            persist(key, result);
            return table;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts linked patents per filtered paper.
     *
     * @param lookbackYears The window length, at least 0.
     * @return Paper id to patent count, with an entry (possibly 0) for every filtered paper.
     *         All counts are 0 if the patent-link table is absent.
     * @throws StoreException if the store cannot answer the query.
     */
    public Map<String, Long> patentCounts(int lookbackYears) throws StoreException {
        Set<String> ids = filteredPaperIds(lookbackYears);
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String id : ids) {
            counts.put(id, 0L);
        }
        if (ids.isEmpty()) {
            return counts;
        }
        if (!store.hasTable(CorpusTable.PATENT_LINKS)) {
            log.debug("No patent-link table configured, reporting zero patents");
            return counts;
        }
        String sql = "SELECT paperid, COUNT(*) AS patent_count FROM " + store.tableSource(CorpusTable.PATENT_LINKS)
            + " WHERE paperid IN (SELECT id FROM " + ID_TABLE + ")"
            + " GROUP BY paperid";
        for (Row row : store.run(sql, Map.of(ID_TABLE, ids)).rows()) {
            counts.put(row.getString("paperid"), row.getLong("patent_count", 0));
        }
        return counts;
    }

    /**
     * Drops the in-process results. Disk cache entries are kept; they are only replaced
     * when the filter signature changes.
     */
    public void invalidate() {
        lock.lock();
        try {
            paperIdsByWindow.clear();
            papersByWindow.clear();
        } finally {
            lock.unlock();
        }
    }

    String paperIdQuery(int lookbackYears) throws StoreException {
        int currentYear = Year.now(clock).getValue();
        int startYear = currentYear - lookbackYears;

        StringBuilder sql = new StringBuilder()
            .append("WITH institution_papers AS (")
            .append(" SELECT DISTINCT paperid FROM ").append(store.tableSource(CorpusTable.AUTHORSHIPS))
            .append(" WHERE institutionid = ").append(SqlText.quote(criteria.institutionId()))
            .append(" AND author_position = ").append(SqlText.quote(criteria.authorPosition().columnValue()))
            .append("), field_papers AS (")
            .append(" SELECT DISTINCT paperid FROM ").append(store.tableSource(CorpusTable.PAPER_FIELDS))
            .append(" WHERE fieldid = ").append(SqlText.quote(criteria.fieldId()))
            .append(")")
            .append(" SELECT DISTINCT p.paperid")
            .append(" FROM ").append(store.tableSource(CorpusTable.PAPERS)).append(" p")
            .append(" INNER JOIN institution_papers i ON p.paperid = i.paperid")
            .append(" INNER JOIN field_papers f ON p.paperid = f.paperid")
            .append(" WHERE p.year >= ").append(startYear)
            .append(" AND p.year <= ").append(currentYear)
            .append(" AND p.doctype = ").append(SqlText.quote(criteria.doctype()));
        if (criteria.excludeRetracted()) {
            sql.append(" AND p.is_retracted = false");
        }
        sql.append(" ORDER BY p.paperid");
        return sql.toString();
    }

    /**
     * Runs the id query into a temporary Parquet file and reads it back in chunks, so the
     * engine never holds the full result and the rows at once.
     */
    private Set<String> streamPaperIds(String sql, int lookbackYears) throws StoreException {
        Path temp = cache.directory().resolve(
            "temp_paper_ids_" + lookbackYears + "yr_" + signature + "_" + UUID.randomUUID() + ".parquet");
        try {
            try {
                store.copyToParquet(sql, Map.of(), temp);
            } catch (StoreException e) {
                log.warn("Streaming the {} year id query failed, running it directly: {}", lookbackYears, e.getMessage());
                return idsOf(store.run(sql));
            }

            Set<String> ids = new LinkedHashSet<>();
            String source = "read_parquet(" + SqlText.quotePath(temp) + ")";
            int offset = 0;
            while (true) {
                QueryResult chunk = store.run("SELECT paperid FROM " + source
                    + " ORDER BY paperid LIMIT " + chunkSize + " OFFSET " + offset);
                if (chunk.isEmpty()) {
                    break;
                }
                for (Row row : chunk.rows()) {
                    ids.add(row.getString("paperid"));
                }
                offset += chunk.rowCount();
                log.debug("Read {} paper ids so far for {} year window", offset, lookbackYears);
            }
            return Collections.unmodifiableSet(ids);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.debug("Failed to delete temporary id file {}", temp, e);
            }
        }
    }

    private void persist(CacheKey key, QueryResult rows) {
        if (cache.write(key, rows, criteria.describe())) {
            cache.deleteLegacy(key);
        }
    }

    private PaperTable toPaperTable(int lookbackYears, QueryResult result) {
        List<Paper> papers = new ArrayList<>(result.rowCount());
        for (Row row : result.rows()) {
            papers.add(Paper.fromRow(row));
        }
        return new PaperTable(lookbackYears, signature, papers);
    }

    private static Set<String> idsOf(QueryResult result) {
        Set<String> ids = new LinkedHashSet<>();
        for (Row row : result.rows()) {
            ids.add(row.getString("paperid"));
        }
        return Collections.unmodifiableSet(ids);
    }

    private static QueryResult toIdResult(Set<String> ids) {
        List<Row> rows = new ArrayList<>(ids.size());
        for (String id : ids) {
            rows.add(new Row(Map.of("paperid", id)));
        }
        return new QueryResult(List.of("paperid"), rows);
    }

    private static void requireWindow(int lookbackYears) {
        if (lookbackYears < 0) {
            throw new IllegalArgumentException("lookbackYears must not be negative, got: " + lookbackYears);
        }
    }
}

package org.scholargraph.sample;

import org.scholargraph.api.resources.store.CorpusTable;
import org.scholargraph.api.resources.store.IColumnarStore;
import org.scholargraph.api.resources.store.StoreException;
import org.scholargraph.filter.CorpusFilterPipeline;
import org.scholargraph.utils.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Materializes the filtered corpus of one lookback window as a self-contained set of
 * {@code sample_*.parquet} files, which the ad-hoc query layer reads instead of the full
 * corpus.
 * <p>
 * References are kept if either endpoint is a filtered paper; fields only if some filtered
 * paper is assigned to them. The patent-link file is skipped when the corpus has none.
 */
public class SampleDatasetExporter {

    private static final Logger log = LoggerFactory.getLogger(SampleDatasetExporter.class);
    private static final String ID_TABLE = "sample_ids";

    /** File names of the exported tables, matching the query store's default configuration. */
    public static final Map<CorpusTable, String> SAMPLE_FILES;

    static {
        Map<CorpusTable, String> files = new EnumMap<>(CorpusTable.class);
        files.put(CorpusTable.PAPERS, "sample_papers.parquet");
        files.put(CorpusTable.REFERENCES, "sample_paperrefs.parquet");
        files.put(CorpusTable.AUTHORSHIPS, "sample_paper_author_affiliation.parquet");
        files.put(CorpusTable.PAPER_FIELDS, "sample_paperfields.parquet");
        files.put(CorpusTable.PATENT_LINKS, "sample_link_patents.parquet");
        files.put(CorpusTable.FIELDS, "sample_fields.parquet");
        SAMPLE_FILES = Collections.unmodifiableMap(files);
    }

    private final IColumnarStore store;
    private final CorpusFilterPipeline pipeline;

    public SampleDatasetExporter(IColumnarStore store, CorpusFilterPipeline pipeline) {
        this.store = Objects.requireNonNull(store, "store");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /**
     * Writes the sample files into {@code targetDirectory}, replacing existing ones.
     *
     * @param lookbackYears   The window of the filtered corpus.
     * @param targetDirectory Destination directory; created if missing.
     * @return Row count per written table, in table order.
     * @throws StoreException if a source table is missing or a copy fails.
     */
    public Map<CorpusTable, Long> export(int lookbackYears, Path targetDirectory) throws StoreException {
        Set<String> ids = pipeline.filteredPaperIds(lookbackYears);
        Map<String, Set<String>> idTables = Map.of(ID_TABLE, ids);
        String inSample = " IN (SELECT id FROM " + ID_TABLE + ")";
        log.info("Exporting sample of {} papers ({} year window) to {}", ids.size(), lookbackYears, targetDirectory);

        Map<CorpusTable, String> queries = new LinkedHashMap<>();
        queries.put(CorpusTable.PAPERS,
            "SELECT * FROM " + store.tableSource(CorpusTable.PAPERS) + " WHERE paperid" + inSample);
        queries.put(CorpusTable.REFERENCES,
            "SELECT * FROM " + store.tableSource(CorpusTable.REFERENCES)
                + " WHERE citing_paperid" + inSample + " OR cited_paperid" + inSample);
        queries.put(CorpusTable.AUTHORSHIPS,
            "SELECT * FROM " + store.tableSource(CorpusTable.AUTHORSHIPS) + " WHERE paperid" + inSample);
        queries.put(CorpusTable.PAPER_FIELDS,
            "SELECT * FROM " + store.tableSource(CorpusTable.PAPER_FIELDS) + " WHERE paperid" + inSample);
        if (store.hasTable(CorpusTable.PATENT_LINKS)) {
            queries.put(CorpusTable.PATENT_LINKS,
                "SELECT * FROM " + store.tableSource(CorpusTable.PATENT_LINKS) + " WHERE paperid" + inSample);
        } else {
            log.info("Corpus has no patent-link table, skipping {}", SAMPLE_FILES.get(CorpusTable.PATENT_LINKS));
        }
        queries.put(CorpusTable.FIELDS,
            "SELECT * FROM " + store.tableSource(CorpusTable.FIELDS)
                + " WHERE fieldid IN (SELECT fieldid FROM " + store.tableSource(CorpusTable.PAPER_FIELDS)
                + " WHERE paperid" + inSample + ")");

        Map<CorpusTable, Long> rowCounts = new EnumMap<>(CorpusTable.class);
        for (Map.Entry<CorpusTable, String> entry : queries.entrySet()) {
            Path target = targetDirectory.resolve(SAMPLE_FILES.get(entry.getKey()));
            store.copyToParquet(entry.getValue(), idTables, target);
            long rows = store.run("SELECT COUNT(*) AS n FROM read_parquet(" + SqlText.quotePath(target) + ")")
                .rows().get(0).getLong("n", 0);
            rowCounts.put(entry.getKey(), rows);
            log.debug("Wrote {} rows to {}", rows, target.getFileName());
        }
        log.info("Sample export complete: {}", rowCounts);
        return rowCounts;
    }
}

package org.scholargraph.graph;

import com.typesafe.config.Config;
import org.scholargraph.api.model.FilterCriteria;
import org.scholargraph.api.model.Graph;
import org.scholargraph.api.model.GraphKind;
import org.scholargraph.api.model.NodeAttributes;
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
import org.scholargraph.api.resources.store.StoreException;
import org.scholargraph.utils.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Derives citation and collaboration graphs from a filtered {@link PaperTable}.
 * <p>
 * Citation edge lists are cached under the window and filter signature of the paper table
 * they were built from. Collaboration graphs are always recomputed.
 * <p>
 * Configuration ({@code graph} block):
 * <ul>
 *   <li>{@code maxCoauthorsPerPaper} (default 50): papers with more qualifying co-authors
 *       contribute nodes but no pairs</li>
 * </ul>
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);
    private static final String ID_TABLE = "filtered_ids";

    private final IColumnarStore store;
    private final IArtifactCache cache;
    private final FilterCriteria criteria;
    private final int maxCoauthorsPerPaper;

    public GraphBuilder(IColumnarStore store, IArtifactCache cache, FilterCriteria criteria, Config options) {
        this.store = Objects.requireNonNull(store, "store");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.criteria = Objects.requireNonNull(criteria, "criteria");
        this.maxCoauthorsPerPaper = options.hasPath("maxCoauthorsPerPaper")
            ? options.getInt("maxCoauthorsPerPaper") : 50;
        if (maxCoauthorsPerPaper < 2) {
            throw new IllegalArgumentException("maxCoauthorsPerPaper must be at least 2, got: " + maxCoauthorsPerPaper);
        }
    }

    public int getMaxCoauthorsPerPaper() {
        return maxCoauthorsPerPaper;
    }

    /**
     * Builds the directed citation graph among the given papers.
     * <p>
     * Every paper becomes a node carrying its year, citation and patent counts. An edge
     * (u, v) means u cites v; both ends are in the table, u differs from v, and the weight
     * is the number of reference rows for the pair.
     *
     * @param papers The filtered papers.
     * @return The citation graph, empty if {@code papers} is empty.
     * @throws StoreException if the references table cannot be queried.
     */
    public Graph buildCitationGraph(PaperTable papers) throws StoreException {
        Graph graph = new Graph(GraphKind.CITATION);
        for (Paper paper : papers.papers()) {
            graph.addNode(paper.id(), NodeAttributes.forPaper(paper));
        }
        if (papers.isEmpty()) {
            return graph;
        }

        CacheKey key = new CacheKey(ArtifactKind.CITATION_EDGES, papers.lookbackYears(), papers.signature());
        CacheReadResult cached = cache.read(key);
        QueryResult edges;
        if (cached.isHit()) {
            edges = cached.rows();
            log.debug("Using {} cached citation edges for {} year window", edges.rowCount(), papers.lookbackYears());
        } else {
            Set<String> ids = papers.paperIds();
            String sql = "SELECT r.citing_paperid, r.cited_paperid, COUNT(*) AS weight"
                + " FROM " + store.tableSource(CorpusTable.REFERENCES) + " r"
                + " WHERE r.citing_paperid IN (SELECT id FROM " + ID_TABLE + ")"
                + " AND r.cited_paperid IN (SELECT id FROM " + ID_TABLE + ")"
                + " AND r.citing_paperid <> r.cited_paperid"
                + " GROUP BY r.citing_paperid, r.cited_paperid"
                + " ORDER BY r.citing_paperid, r.cited_paperid";
            edges = store.run(sql, Map.of(ID_TABLE, ids));
            if (cache.write(key, edges, criteria.describe())) {
                cache.deleteLegacy(key);
            }
        }

        for (Row row : edges.rows()) {
            String citing = row.getString("citing_paperid");
            String cited = row.getString("cited_paperid");
            if (graph.containsNode(citing) && graph.containsNode(cited) && !citing.equals(cited)) {
                graph.addEdge(citing, cited, row.getLong("weight", 1));
            }
        }
        log.info("Built citation graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Builds the undirected collaboration graph among the institution's authors.
     * <p>
     * Nodes are all authors affiliated with the filtered institution on any of the given
     * papers, regardless of byline position; each carries its number of such papers. The
     * weight of (a, b) is the number of papers on which both are affiliated with the
     * institution, counting only papers with at most {@code maxCoauthorsPerPaper} such
     * authors.
     *
     * @param papers The filtered papers.
     * @return The collaboration graph, empty if {@code papers} is empty.
     * @throws StoreException if the authorship table cannot be queried.
     */
    public Graph buildCollaborationGraph(PaperTable papers) throws StoreException {
        Graph graph = new Graph(GraphKind.COLLABORATION);
        if (papers.isEmpty()) {
            return graph;
        }

        Map<String, Set<String>> idTables = Map.of(ID_TABLE, papers.paperIds());
        String institutionAuthors = "SELECT DISTINCT paperid, authorid"
            + " FROM " + store.tableSource(CorpusTable.AUTHORSHIPS)
            + " WHERE institutionid = " + SqlText.quote(criteria.institutionId())
            + " AND authorid IS NOT NULL"
            + " AND paperid IN (SELECT id FROM " + ID_TABLE + ")";

        String nodeSql = "WITH institution_authors AS (" + institutionAuthors + ")"
            + " SELECT authorid, COUNT(*) AS paper_count"
            + " FROM institution_authors"
            + " GROUP BY authorid"
            + " ORDER BY authorid";
        for (Row row : store.run(nodeSql, idTables).rows()) {
            graph.addNode(row.getString("authorid"), NodeAttributes.forAuthor(row.getLong("paper_count", 0)));
        }

        String pairSql = "WITH institution_authors AS (" + institutionAuthors + "),"
            + " eligible_papers AS ("
            + " SELECT paperid FROM institution_authors"
            + " GROUP BY paperid HAVING COUNT(*) <= " + maxCoauthorsPerPaper + ")"
            + " SELECT a1.authorid AS author1, a2.authorid AS author2, COUNT(*) AS weight"
            + " FROM institution_authors a1"
            + " INNER JOIN institution_authors a2 ON a1.paperid = a2.paperid AND a1.authorid < a2.authorid"
            + " WHERE a1.paperid IN (SELECT paperid FROM eligible_papers)"
            + " GROUP BY a1.authorid, a2.authorid"
            + " ORDER BY author1, author2";
        for (Row row : store.run(pairSql, idTables).rows()) {
            graph.addEdge(row.getString("author1"), row.getString("author2"), row.getLong("weight", 1));
        }

        log.info("Built collaboration graph with {} authors and {} pairs", graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}

package org.scholargraph.api.resources.store;

/**
 * The logical tables of a scholarly-publication corpus.
 * <p>
 * Each table maps to one Parquet file inside the store's data directory. The file name is
 * configurable under {@code tables.<configKey>}; {@link #defaultFileName()} is used otherwise.
 */
public enum CorpusTable {
    /** paperid, year, doctype, is_retracted, cited_by_count, patent_count */
    PAPERS("papers", "sciscinet_papers.parquet"),
    /** citing_paperid, cited_paperid */
    REFERENCES("references", "sciscinet_paperrefs.parquet"),
    /** paperid, authorid, institutionid, author_position */
    AUTHORSHIPS("authorships", "sciscinet_paper_author_affiliation.parquet"),
    /** paperid, fieldid */
    PAPER_FIELDS("paperFields", "sciscinet_paperfields.parquet"),
    /** paperid, patent */
    PATENT_LINKS("patentLinks", "sciscinet_link_patents.parquet"),
    /** fieldid, display_name */
    FIELDS("fields", "sciscinet_fields.parquet");

    private final String configKey;
    private final String defaultFileName;

    CorpusTable(String configKey, String defaultFileName) {
        this.configKey = configKey;
        this.defaultFileName = defaultFileName;
    }

    public String configKey() {
        return configKey;
    }

    public String defaultFileName() {
        return defaultFileName;
    }
}

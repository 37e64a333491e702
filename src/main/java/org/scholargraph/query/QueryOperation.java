package org.scholargraph.query;

import java.util.Locale;

/**
 * The ad-hoc operations offered to collaborators, with the names they are invoked by.
 */
public enum QueryOperation {
    PAPERS("query_papers"),
    PAPERS_BY_FIELD("query_papers_by_field"),
    PAPERS_BY_YEAR("query_papers_by_year"),
    PAPERS_BY_CITATIONS("query_papers_by_citations"),
    PAPERS_BY_PATENTS("query_papers_by_patents"),
    ADVANCED("query_papers_advanced"),
    AVAILABLE_FIELDS("explore_available_fields"),
    AVAILABLE_YEARS("explore_available_years"),
    TOP_AUTHORS("explore_top_authors"),
    FIELD_TRENDS("analyze_field_trends"),
    CITATION_PATTERNS("analyze_citation_patterns"),
    PATENT_DISTRIBUTION("analyze_patent_distribution");

    private final String toolName;

    QueryOperation(String toolName) {
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }

    /**
     * Resolves a tool name ({@code query_papers_by_field}) or constant name
     * ({@code PAPERS_BY_FIELD}, case-insensitive).
     *
     * @throws IllegalArgumentException if the name matches no operation.
     */
    public static QueryOperation fromName(String name) {
        for (QueryOperation operation : values()) {
            if (operation.toolName.equals(name) || operation.name().equals(name.toUpperCase(Locale.ROOT))) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown query operation: " + name);
    }
}

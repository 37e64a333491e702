package org.scholargraph.api.resources.cache;

/**
 * The derived artifacts persisted by the disk cache. The prefix is the leading part of the
 * cache file name.
 */
public enum ArtifactKind {
    PAPER_IDS("filtered_paper_ids"),
    PAPER_TABLE("filtered_papers"),
    CITATION_EDGES("citation_network");

    private final String filePrefix;

    ArtifactKind(String filePrefix) {
        this.filePrefix = filePrefix;
    }

    public String filePrefix() {
        return filePrefix;
    }
}

package org.scholargraph.api.model;

public enum GraphKind {
    /** Directed paper-to-paper citations. */
    CITATION(true),
    /** Undirected author co-affiliation on shared papers. */
    COLLABORATION(false);

    private final boolean directed;

    GraphKind(boolean directed) {
        this.directed = directed;
    }

    public boolean isDirected() {
        return directed;
    }
}

package org.scholargraph.api.model;

import org.scholargraph.api.resources.store.Row;

import java.util.Objects;

/**
 * Attributes of one paper as loaded from the papers table.
 *
 * @param id           Globally unique paper id.
 * @param year         Publication year.
 * @param doctype      Document type, e.g. {@code article}.
 * @param retracted    Whether the paper is retracted.
 * @param citedByCount Number of citing papers, never negative.
 * @param patentCount  Number of linked patents, never negative.
 */
public record Paper(String id, int year, String doctype, boolean retracted, long citedByCount, long patentCount) {

    public Paper {
        Objects.requireNonNull(id, "id");
        if (citedByCount < 0 || patentCount < 0) {
            throw new IllegalArgumentException("Counts must not be negative for paper " + id);
        }
    }

    /**
     * Maps a papers-table row. Missing counts are read as zero.
     *
     * @param row A row with at least {@code paperid} and {@code year}.
     * @return The paper.
     */
    public static Paper fromRow(Row row) {
        return new Paper(
            row.getString("paperid"),
            row.getInt("year", 0),
            row.getString("doctype"),
            row.getBoolean("is_retracted", false),
            Math.max(0, row.getLong("cited_by_count", 0)),
            Math.max(0, row.getLong("patent_count", 0)));
    }
}

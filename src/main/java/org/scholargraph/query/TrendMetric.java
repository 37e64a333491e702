package org.scholargraph.query;

import java.util.Locale;

/**
 * Per-year aggregate reported by the trend query.
 */
public enum TrendMetric {
    /** Number of distinct papers. */
    COUNT("COUNT(DISTINCT p.paperid)"),
    /** Average citation count. */
    CITATIONS("AVG(p.cited_by_count)"),
    /** Average patent count. */
    PATENTS("AVG(p.patent_count)");

    private final String aggregate;

    TrendMetric(String aggregate) {
        this.aggregate = aggregate;
    }

    String aggregate() {
        return aggregate;
    }

    /**
     * Unrecognized names fall back to {@link #COUNT}.
     */
    public static TrendMetric parse(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (TrendMetric metric : values()) {
            if (metric.name().equals(normalized)) {
                return metric;
            }
        }
        return COUNT;
    }
}

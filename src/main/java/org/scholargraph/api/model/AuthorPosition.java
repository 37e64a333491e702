package org.scholargraph.api.model;

import java.util.Locale;

/**
 * Position of an author in a paper's byline, as stored in the {@code author_position} column.
 */
public enum AuthorPosition {
    FIRST, MIDDLE, LAST;

    /**
     * @return The value used in the corpus, e.g. {@code "first"}.
     */
    public String columnValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a configured or stored value, case-insensitively.
     *
     * @param value The value, e.g. {@code "first"}.
     * @return The position.
     * @throws IllegalArgumentException if the value names no position.
     */
    public static AuthorPosition parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

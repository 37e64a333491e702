package org.scholargraph.utils;

import java.nio.file.Path;

/**
 * Literal quoting for SQL text sent to the embedded engine.
 */
public final class SqlText {

    private SqlText() {
        // Utility class
    }

    /**
     * Quotes a string as a SQL literal, doubling embedded single quotes.
     *
     * @param value The raw string.
     * @return The quoted literal, e.g. {@code 'O''Brien'}.
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Quotes a file path as a SQL literal. Windows separators are normalized to '/'.
     *
     * @param path The file path.
     * @return The quoted absolute path.
     */
    public static String quotePath(Path path) {
        return quote(path.toAbsolutePath().toString().replace("\\", "/"));
    }

    /**
     * Quotes an identifier (table or column name) with double quotes.
     *
     * @param identifier The raw identifier.
     * @return The quoted identifier.
     */
    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}

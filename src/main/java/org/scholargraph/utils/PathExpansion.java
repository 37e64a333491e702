package org.scholargraph.utils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${VAR}} references in configured paths.
 * <p>
 * A reference resolves to the Java system property of that name, or, if none is set, to the
 * environment variable of that name. {@code ${user.home}/scholargraph/cache} and
 * {@code ${SCHOLARGRAPH_DATA}/parquet} are both valid.
 */
public final class PathExpansion {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]*)}");

    private PathExpansion() {
        // Utility class
    }

    /**
     * @param path A path that may contain {@code ${VAR}} references; {@code null} is returned unchanged.
     * @return The path with every reference replaced.
     * @throws IllegalArgumentException if a reference is unclosed, empty or undefined.
     */
    public static String expandPath(String path) {
        if (path == null || !path.contains("${")) {
            return path;
        }

        Matcher matcher = VARIABLE.matcher(path);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (name.isBlank()) {
                throw new IllegalArgumentException("Empty variable reference in path: " + path);
            }
            String value = resolveVariable(name);
            if (value == null) {
                throw new IllegalArgumentException(
                    "Undefined variable '${" + name + "}' in path: " + path
                        + ". Define it as a system property or environment variable.");
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);

        String expanded = result.toString();
        if (expanded.contains("${")) {
            throw new IllegalArgumentException("Unclosed variable in path: " + path);
        }
        return expanded;
    }

    /**
     * Expands a path and requires the result to be absolute.
     *
     * @param path    The configured path.
     * @param setting Name of the setting, used in the error message.
     * @return The expanded absolute path.
     * @throws IllegalArgumentException if the expanded path is relative.
     */
    public static Path expandAbsolute(String path, String setting) {
        Path expanded = Paths.get(expandPath(path));
        if (!expanded.isAbsolute()) {
            throw new IllegalArgumentException(setting + " must be an absolute path: " + expanded);
        }
        return expanded;
    }

    private static String resolveVariable(String name) {
        String value = System.getProperty(name);
        return value != null ? value : System.getenv(name);
    }
}

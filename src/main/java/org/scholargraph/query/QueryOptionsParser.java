package org.scholargraph.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts loosely typed parameters, as sent by agents and the command line, into
 * {@link QueryOptions}.
 * <p>
 * Recognized keys: {@code field} (aliases {@code field_name}, {@code field_filter}),
 * {@code fields}, {@code author_id}, {@code author_ids}, {@code year}, {@code start_year},
 * {@code end_year}, {@code year_range} ({@code [start, end]}), {@code years} (alias
 * {@code lookback_years}), {@code min_citations}, {@code max_citations}, {@code min_patents},
 * {@code has_patents}, {@code limit}, {@code min_papers}, {@code metric}. Unknown keys are
 * ignored. Numbers may arrive as integral numbers or numeric strings; null values count as
 * absent.
 */
public final class QueryOptionsParser {

    private static final Logger log = LoggerFactory.getLogger(QueryOptionsParser.class);

    private QueryOptionsParser() {
    }

    /**
     * @param params Parameter map; may be null.
     * @return The parsed options.
     * @throws IllegalArgumentException if a recognized key has a value of the wrong type, or a
     *                                  year or citation range is inverted.
     */
    public static QueryOptions parse(Map<String, ?> params) {
        QueryOptions.Builder builder = QueryOptions.builder();
        if (params == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "field", "field_name", "field_filter" -> builder.field(asString(key, value));
                case "fields" -> builder.fields(asStringList(key, value));
                case "author_id" -> builder.authorId(asString(key, value));
                case "author_ids" -> builder.authorIds(asStringList(key, value));
                case "year" -> builder.year(asInt(key, value));
                case "start_year" -> builder.startYear(asInt(key, value));
                case "end_year" -> builder.endYear(asInt(key, value));
                case "year_range" -> {
                    if (!(value instanceof List<?> range) || range.size() != 2) {
                        throw new IllegalArgumentException("year_range must be a list [start, end], got: " + value);
                    }
                    builder.yearRange(asInt(key, range.get(0)), asInt(key, range.get(1)));
                }
                case "years", "lookback_years" -> builder.lookbackYears(asInt(key, value));
                case "min_citations" -> builder.minCitations(asInt(key, value));
                case "max_citations" -> builder.maxCitations(asInt(key, value));
                case "min_patents" -> builder.minPatents(asInt(key, value));
                case "has_patents" -> builder.hasPatents(asBoolean(key, value));
                case "limit" -> builder.limit(asInt(key, value));
                case "min_papers" -> builder.minPapers(asInt(key, value));
                case "metric" -> builder.metric(TrendMetric.parse(asString(key, value)));
                default -> log.debug("Ignoring unknown query parameter '{}'", key);
            }
        }
        QueryOptions options = builder.build();
        if (options.hasInvertedRange()) {
            throw new IllegalArgumentException("inverted year or citation range: " + options);
        }
        return options;
    }

    static int asInt(String key, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(key + " is out of range: " + value);
            }
            return (int) number;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException(key + " must be a whole number, got: " + value);
            }
            return asInt(key, (long) d);
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number, got: '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException(key + " must be a number, got " + value.getClass().getSimpleName());
    }

    static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true")) return true;
            if (normalized.equals("false")) return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got: " + value);
    }

    static String asString(String key, Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number) {
            return value.toString();
        }
        throw new IllegalArgumentException(key + " must be a string, got " + value.getClass().getSimpleName());
    }

    static List<String> asStringList(String key, Object value) {
        if (value instanceof List<?> list) {
            List<String> strings = new ArrayList<>(list.size());
            for (Object element : list) {
                if (element != null) {
                    strings.add(asString(key, element));
                }
            }
            return strings;
        }
        return List.of(asString(key, value));
    }
}

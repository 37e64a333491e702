package org.scholargraph.query;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Optional predicates and modifiers accepted by the ad-hoc queries. Each operation reads the
 * options it understands and ignores the rest.
 * <p>
 * Within a repeated group ({@link #fields()}, {@link #authorIds()}) values are alternatives;
 * distinct groups must all hold. An inverted year or citation range is accepted and matches
 * no paper, so every operation that reads it returns an empty table.
 */
public final class QueryOptions {

    private static final QueryOptions NONE = builder().build();

    private final String field;
    private final List<String> fields;
    private final List<String> authorIds;
    private final Integer year;
    private final Integer startYear;
    private final Integer endYear;
    private final Integer lookbackYears;
    private final Integer minCitations;
    private final Integer maxCitations;
    private final Integer minPatents;
    private final boolean hasPatents;
    private final Integer limit;
    private final Integer minPapers;
    private final TrendMetric metric;

    private QueryOptions(Builder builder) {
        this.field = builder.field;
        this.fields = List.copyOf(builder.fields);
        this.authorIds = List.copyOf(builder.authorIds);
        this.year = builder.year;
        this.startYear = builder.startYear;
        this.endYear = builder.endYear;
        this.lookbackYears = builder.lookbackYears;
        this.minCitations = builder.minCitations;
        this.maxCitations = builder.maxCitations;
        this.minPatents = builder.minPatents;
        this.hasPatents = builder.hasPatents;
        this.limit = builder.limit;
        this.minPapers = builder.minPapers;
        this.metric = builder.metric;
    }

    public static QueryOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Case-insensitive substring of a field display name. */
    public Optional<String> field() {
        return Optional.ofNullable(field);
    }

    /** Exact field display names. */
    public List<String> fields() {
        return fields;
    }

    public List<String> authorIds() {
        return authorIds;
    }

    public OptionalInt year() {
        return optional(year);
    }

    public OptionalInt startYear() {
        return optional(startYear);
    }

    public OptionalInt endYear() {
        return optional(endYear);
    }

    /** Only papers from the last N years. */
    public OptionalInt lookbackYears() {
        return optional(lookbackYears);
    }

    public OptionalInt minCitations() {
        return optional(minCitations);
    }

    public OptionalInt maxCitations() {
        return optional(maxCitations);
    }

    public OptionalInt minPatents() {
        return optional(minPatents);
    }

    public boolean hasPatents() {
        return hasPatents;
    }

    /** Positive row limit; absent means unlimited. */
    public OptionalInt limit() {
        return optional(limit);
    }

    public OptionalInt minPapers() {
        return optional(minPapers);
    }

    public TrendMetric metric() {
        return metric;
    }

    /**
     * @return Whether the start year is after the end year or the minimum citation count
     *         exceeds the maximum.
     */
    public boolean hasInvertedRange() {
        return (startYear != null && endYear != null && startYear > endYear)
            || (minCitations != null && maxCitations != null && minCitations > maxCitations);
    }

    private static OptionalInt optional(Integer value) {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public String toString() {
        return "QueryOptions{field=" + field + ", fields=" + fields + ", authorIds=" + authorIds
            + ", year=" + year + ", startYear=" + startYear + ", endYear=" + endYear
            + ", lookbackYears=" + lookbackYears + ", minCitations=" + minCitations
            + ", maxCitations=" + maxCitations + ", minPatents=" + minPatents
            + ", hasPatents=" + hasPatents + ", limit=" + limit + ", minPapers=" + minPapers
            + ", metric=" + metric + "}";
    }

    public static final class Builder {
        private String field;
        private List<String> fields = List.of();
        private List<String> authorIds = List.of();
        private Integer year;
        private Integer startYear;
        private Integer endYear;
        private Integer lookbackYears;
        private Integer minCitations;
        private Integer maxCitations;
        private Integer minPatents;
        private boolean hasPatents;
        private Integer limit;
        private Integer minPapers;
        private TrendMetric metric = TrendMetric.COUNT;

        private Builder() {
        }

        public Builder field(String field) {
            this.field = field == null || field.isBlank() ? null : field;
            return this;
        }

        public Builder fields(List<String> fields) {
            this.fields = List.copyOf(fields);
            return this;
        }

        public Builder authorIds(List<String> authorIds) {
            this.authorIds = List.copyOf(authorIds);
            return this;
        }

        public Builder authorId(String authorId) {
            return authorIds(authorId == null ? List.of() : List.of(authorId));
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder startYear(Integer startYear) {
            this.startYear = startYear;
            return this;
        }

        public Builder endYear(Integer endYear) {
            this.endYear = endYear;
            return this;
        }

        public Builder yearRange(int start, int end) {
            this.startYear = start;
            this.endYear = end;
            return this;
        }

        public Builder lookbackYears(Integer lookbackYears) {
            this.lookbackYears = lookbackYears;
            return this;
        }

        public Builder minCitations(Integer minCitations) {
            this.minCitations = minCitations;
            return this;
        }

        public Builder maxCitations(Integer maxCitations) {
            this.maxCitations = maxCitations;
            return this;
        }

        public Builder minPatents(Integer minPatents) {
            this.minPatents = minPatents;
            return this;
        }

        public Builder hasPatents(boolean hasPatents) {
            this.hasPatents = hasPatents;
            return this;
        }

        /**
         * @param limit Row limit; null, 0 or negative means unlimited.
         */
        public Builder limit(Integer limit) {
            this.limit = limit != null && limit > 0 ? limit : null;
            return this;
        }

        public Builder minPapers(Integer minPapers) {
            this.minPapers = minPapers;
            return this;
        }

        public Builder metric(TrendMetric metric) {
            this.metric = metric == null ? TrendMetric.COUNT : metric;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
}

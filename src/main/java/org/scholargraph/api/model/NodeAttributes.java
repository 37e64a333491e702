package org.scholargraph.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable attributes attached to a graph node.
 * <p>
 * Paper nodes carry {@code year}, {@code cited_by_count} and {@code patent_count}; author
 * nodes carry {@code paper_count}.
 */
public final class NodeAttributes {

    private static final NodeAttributes NONE = new NodeAttributes(Map.of());

    private final Map<String, Object> values;

    private NodeAttributes(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static NodeAttributes none() {
        return NONE;
    }

    public static NodeAttributes of(Map<String, Object> values) {
        return values.isEmpty() ? NONE : new NodeAttributes(values);
    }

    public static NodeAttributes forPaper(Paper paper) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("year", paper.year());
        values.put("cited_by_count", paper.citedByCount());
        values.put("patent_count", paper.patentCount());
        return new NodeAttributes(values);
    }

    public static NodeAttributes forAuthor(long paperCount) {
        return new NodeAttributes(Map.of("paper_count", paperCount));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeAttributes that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

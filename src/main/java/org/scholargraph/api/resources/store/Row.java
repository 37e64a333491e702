package org.scholargraph.api.resources.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One record of a {@link QueryResult}, keyed by column label in select order.
 * <p>
 * Numeric accessors accept any {@link Number} the engine returns (INTEGER, BIGINT, HUGEINT,
 * DOUBLE) and map SQL {@code NULL} to the supplied default.
 */
public final class Row {

    private final Map<String, Object> values;

    public Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean isNull(String column) {
        return values.get(column) == null;
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public long getLong(String column, long defaultValue) {
        Object value = values.get(column);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public int getInt(String column, int defaultValue) {
        return Math.toIntExact(getLong(column, defaultValue));
    }

    public double getDouble(String column, double defaultValue) {
        Object value = values.get(column);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    public boolean getBoolean(String column, boolean defaultValue) {
        Object value = values.get(column);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * @return An unmodifiable, insertion-ordered view of the row.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row row)) return false;
        return values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

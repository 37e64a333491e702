package org.scholargraph.query.sql;

import org.scholargraph.utils.SqlText;

final class Literals {

    private Literals() {
    }

    static String render(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Not a finite SQL literal: " + value);
            }
            return Double.toString(d);
        }
        if (value instanceof String text) {
            return SqlText.quote(text);
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }
}

package org.scholargraph.query.sql;

import org.scholargraph.utils.SqlText;

import java.util.Objects;

/**
 * Case-insensitive substring match. Wildcards in the search text match literally.
 *
 * @param expression The column to search.
 * @param text       The substring to look for.
 */
public record ILike(String expression, String text) implements SqlPredicate {

    public ILike {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toSql() {
        String escaped = text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return expression + " ILIKE " + SqlText.quote("%" + escaped + "%") + " ESCAPE '\\'";
    }
}

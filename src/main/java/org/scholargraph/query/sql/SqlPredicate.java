package org.scholargraph.query.sql;

/**
 * A boolean SQL expression. Implementations render themselves fully parenthesized where
 * precedence matters, so predicates can be nested freely.
 */
public interface SqlPredicate {

    /**
     * @return The SQL text of this predicate.
     */
    String toSql();
}

package org.scholargraph.query.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builder for a single SELECT statement.
 * <p>
 * Every {@link #where(SqlPredicate)} call adds one operand of the WHERE conjunction; OR
 * groups are expressed as a {@link Disjunction} operand. A null predicate is ignored, so
 * optional filters can be passed straight through.
 * <pre>
 * SelectQuery.select("p.year", "COUNT(*) AS count")
 *     .from("read_parquet('papers.parquet')", "p")
 *     .where(Predicates.ge("p.year", 2020))
 *     .groupBy("p.year")
 *     .orderBy("p.year")
 *     .toSql();
 * </pre>
 */
public final class SelectQuery {

    private final List<String> columns;
    private boolean distinct;
    private String from;
    private final List<String> joins = new ArrayList<>();
    private final List<SqlPredicate> where = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<SqlPredicate> having = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private Integer limit;

    private SelectQuery(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    public static SelectQuery select(String... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("At least one column is required");
        }
        return new SelectQuery(Arrays.asList(columns));
    }

    public SelectQuery distinct() {
        this.distinct = true;
        return this;
    }

    public SelectQuery from(String source, String alias) {
        this.from = source + " " + alias;
        return this;
    }

    public SelectQuery from(SelectQuery subquery, String alias) {
        return from("(" + subquery.toSql() + ")", alias);
    }

    public SelectQuery join(String source, String alias, String on) {
        joins.add("INNER JOIN " + source + " " + alias + " ON " + on);
        return this;
    }

    public SelectQuery leftJoin(String source, String alias, String on) {
        joins.add("LEFT JOIN " + source + " " + alias + " ON " + on);
        return this;
    }

    public SelectQuery leftJoin(SelectQuery subquery, String alias, String on) {
        return leftJoin("(" + subquery.toSql() + ")", alias, on);
    }

    public SelectQuery where(SqlPredicate predicate) {
        if (predicate != null) {
            where.add(predicate);
        }
        return this;
    }

    public SelectQuery groupBy(String... expressions) {
        groupBy.addAll(Arrays.asList(expressions));
        return this;
    }

    public SelectQuery having(SqlPredicate predicate) {
        if (predicate != null) {
            having.add(predicate);
        }
        return this;
    }

    public SelectQuery orderBy(String... expressions) {
        orderBy.addAll(Arrays.asList(expressions));
        return this;
    }

    /**
     * @param limit Maximum row count; null or a value below 1 means unlimited.
     */
    public SelectQuery limit(Integer limit) {
        this.limit = limit != null && limit > 0 ? limit : null;
        return this;
    }

    public String toSql() {
        Objects.requireNonNull(from, "from() must be called before toSql()");
        StringBuilder sql = new StringBuilder("SELECT ");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(String.join(", ", columns));
        sql.append(" FROM ").append(from);
        for (String join : joins) {
            sql.append(' ').append(join);
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(new Conjunction(where).toSql());
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        if (!having.isEmpty()) {
            sql.append(" HAVING ").append(new Conjunction(having).toSql());
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSql();
    }
}

package org.scholargraph.query.sql;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.scholargraph.junit.extensions.logging.LogWatchExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.scholargraph.query.sql.Predicates.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SelectQueryTest {

    @Test
    void testToSql_RendersClausesInOrder() {
        String sql = SelectQuery.select("p.year", "COUNT(*) AS count")
            .from("papers", "p")
            .leftJoin("fields", "f", "p.fieldid = f.fieldid")
            .where(ge("p.year", 2020))
            .where(le("p.year", 2024))
            .groupBy("p.year")
            .having(gt("COUNT(*)", 1))
            .orderBy("p.year")
            .limit(5)
            .toSql();

        assertThat(sql).isEqualTo("SELECT p.year, COUNT(*) AS count FROM papers p"
            + " LEFT JOIN fields f ON p.fieldid = f.fieldid"
            + " WHERE (p.year >= 2020) AND (p.year <= 2024)"
            + " GROUP BY p.year HAVING COUNT(*) > 1 ORDER BY p.year LIMIT 5");
    }

    @Test
    void testWhere_NullPredicateIsIgnored() {
        String sql = SelectQuery.select("*").from("papers", "p").where(null).toSql();

        assertThat(sql).isEqualTo("SELECT * FROM papers p");
    }

    @Test
    void testLimit_NonPositiveMeansUnlimited() {
        assertThat(SelectQuery.select("*").from("t", "x").limit(0).toSql()).doesNotContain("LIMIT");
        assertThat(SelectQuery.select("*").from("t", "x").limit(null).toSql()).doesNotContain("LIMIT");
    }

    @Test
    void testSubqueries_AreParenthesized() {
        SelectQuery inner = SelectQuery.select("paperid").from("links", "l").distinct();

        String sql = SelectQuery.select("p.*")
            .from("papers", "p")
            .where(in("p.paperid", inner))
            .toSql();

        assertThat(sql).isEqualTo("SELECT p.* FROM papers p WHERE p.paperid IN (SELECT DISTINCT paperid FROM links l)");
    }

    @Test
    void testSelect_RequiresColumnsAndSource() {
        assertThatThrownBy(() -> SelectQuery.select()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SelectQuery.select("*").toSql()).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testOrGroup_IsOneOperandOfTheConjunction() {
        String sql = SelectQuery.select("*")
            .from("t", "x")
            .where(eq("x.a", 1))
            .where(or(eq("x.b", "u"), in("x.b", List.of("v", "w"))))
            .toSql();

        assertThat(sql).endsWith("WHERE (x.a = 1) AND (((x.b = 'u') OR (x.b IN ('v', 'w'))))");
    }
}

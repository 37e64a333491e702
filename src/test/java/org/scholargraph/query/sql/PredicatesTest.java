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
class PredicatesTest {

    @Test
    void testComparison_RendersLiterals() {
        assertThat(eq("p.year", 2021).toSql()).isEqualTo("p.year = 2021");
        assertThat(ge("p.score", 1.5).toSql()).isEqualTo("p.score >= 1.5");
        assertThat(eq("p.is_retracted", false).toSql()).isEqualTo("p.is_retracted = FALSE");
        assertThat(eq("a.name", "O'Brien").toSql()).isEqualTo("a.name = 'O''Brien'");
    }

    @Test
    void testComparison_RejectsUnsupportedLiterals() {
        assertThatThrownBy(() -> eq("x", Double.NaN).toSql()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> eq("x", new Object()).toSql()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testILike_EscapesWildcards() {
        assertThat(ilike("f.display_name", "learning").toSql())
            .isEqualTo("f.display_name ILIKE '%learning%' ESCAPE '\\'");
        assertThat(ilike("f.display_name", "100%_sure").toSql())
            .isEqualTo("f.display_name ILIKE '%100\\%\\_sure%' ESCAPE '\\'");
    }

    @Test
    void testInList_EmptyListMatchesNothing() {
        assertThat(in("a.id", List.of()).toSql()).isEqualTo("FALSE");
        assertThat(in("a.id", List.of("A1", "A2")).toSql()).isEqualTo("a.id IN ('A1', 'A2')");
    }

    @Test
    void testJunctions_HandleEmptyAndSingleOperands() {
        assertThat(and(List.of()).toSql()).isEqualTo("TRUE");
        assertThat(or(List.of()).toSql()).isEqualTo("FALSE");
        assertThat(or(eq("a", 1)).toSql()).isEqualTo("a = 1");
        assertThat(and(eq("a", 1), isNotNull("b")).toSql()).isEqualTo("(a = 1) AND (b IS NOT NULL)");
        assertThat(or(eq("a", 1), eq("a", 2)).toSql()).isEqualTo("((a = 1) OR (a = 2))");
    }
}

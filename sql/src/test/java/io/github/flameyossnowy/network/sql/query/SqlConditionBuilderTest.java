package io.github.flameyossnowy.network.sql.query;

import io.github.flameyossnowy.network.api.options.RelationFilter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlConditionBuilderTest {
    @Test
    void rendersEachConditionAsAParameter() {
        StringBuilder sql = new StringBuilder("SELECT e.* FROM invites e WHERE e.person_id = ?");
        List<Object> parameters = new ArrayList<>(List.of(1L));

        SqlConditionBuilder.append(sql, parameters, "e",
            RelationFilter.where("is_accepted").eq(true).and("person_id_target").ne(4L).and("message").isNotNull());

        assertEquals("SELECT e.* FROM invites e WHERE e.person_id = ?"
            + " AND e.is_accepted = ? AND e.person_id_target <> ? AND e.message IS NOT NULL", sql.toString());
        assertEquals(List.of(1L, true, 4L), parameters);
    }

    @Test
    void comparisonWithNullMatchesNothing() {
        StringBuilder sql = new StringBuilder("SELECT 1");
        List<Object> parameters = new ArrayList<>();

        SqlConditionBuilder.append(sql, parameters, "t", RelationFilter.where("message").eq(null));

        assertEquals("SELECT 1 AND 1 = 0", sql.toString());
        assertTrue(parameters.isEmpty());
    }

    @Test
    void nullFilterAddsNothing() {
        StringBuilder sql = new StringBuilder("SELECT 1");
        SqlConditionBuilder.append(sql, new ArrayList<>(), "t", null);
        assertEquals("SELECT 1", sql.toString());
    }
}

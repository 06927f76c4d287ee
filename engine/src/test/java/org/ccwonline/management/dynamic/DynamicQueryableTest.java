package org.ccwonline.management.dynamic;

import org.ccwonline.management.dynamic.classes.DynamicClass;
import org.ccwonline.management.model.Conference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DynamicQueryable Tests")
class DynamicQueryableTest {

    private List<Conference> conferences;

    @BeforeEach
    void setUp() {
        conferences = new ArrayList<>();
        for (int id = 1; id <= 200; id++) {
            conferences.add(new Conference(id, "Conference " + id, id % 50, id % 3));
        }
    }

    private DynamicQueryable query() {
        return DynamicQueryable.of(Conference.class, conferences);
    }

    @Nested
    @DisplayName("Where")
    class Where {

        @Test
        @DisplayName("Filters by a literal comparison")
        void testLiteral() {
            List<Conference> result = query().where("ConferenceId < 100").toList(Conference.class);
            assertEquals(99, result.size());
            assertTrue(result.stream().allMatch(c -> c.conferenceId() < 100));
        }

        @Test
        @DisplayName("Substitutes positional values")
        void testPositional() {
            assertEquals(10, query().where("ConferenceId > @0 and ConferenceId <= @1", 100, 110).count());
        }

        @Test
        @DisplayName("Substitutes named values from a trailing map")
        void testNamed() {
            assertEquals(4, query().where("Status == @0 and ConferenceId < limit", 0, Map.of("limit", 13)).count());
        }

        @Test
        @DisplayName("Leaves the source untouched")
        void testSourceUnchanged() {
            DynamicQueryable all = query();
            all.where("ConferenceId == 1");
            assertEquals(200, all.count());
            assertEquals(200, conferences.size());
        }

        @Test
        @DisplayName("Rejects a non-boolean predicate")
        void testNonBoolean() {
            assertThrows(ParseException.class, () -> query().where("ConferenceId + 1"));
        }
    }

    @Nested
    @DisplayName("OrderBy")
    class OrderBy {

        @Test
        @DisplayName("Sorts by several keys with mixed directions")
        void testMultiKey() {
            List<Conference> source = List.of(
                    new Conference(3, "a", 0, 1),
                    new Conference(5, "b", 0, 2),
                    new Conference(9, "c", 0, 1));
            List<Integer> ids = DynamicQueryable.of(Conference.class, source)
                    .orderBy("Status, ConferenceId desc")
                    .toList(Conference.class).stream().map(Conference::conferenceId).toList();
            assertEquals(List.of(9, 3, 5), ids);
        }

        @Test
        @DisplayName("Keeps source order among equal keys")
        void testStable() {
            List<Integer> ids = query().where("ConferenceId <= 6").orderBy("Status descending")
                    .toList(Conference.class).stream().map(Conference::conferenceId).toList();
            assertEquals(List.of(2, 5, 1, 4, 3, 6), ids);
        }

        @Test
        @DisplayName("Reports an unknown property")
        void testUnknownProperty() {
            ParseException e = assertThrows(ParseException.class, () -> query().orderBy("Missing"));
            assertEquals(0, e.getPosition());
        }
    }

    @Nested
    @DisplayName("Select and GroupBy")
    class Projection {

        @Test
        @DisplayName("Projects into a dynamic record")
        void testSelectNew() {
            List<Object> rows = query().where("ConferenceId == 7").select("new(ConferenceId, Name as Title)").toList();
            assertEquals(1, rows.size());
            DynamicClass row = (DynamicClass) rows.get(0);
            assertEquals(7, row.get("ConferenceId"));
            assertEquals("Conference 7", row.get("Title"));
        }

        @Test
        @DisplayName("Projects a single member")
        void testSelectMember() {
            assertEquals(List.of(1, 2, 3), query().take(3).select("ConferenceId").toList(Integer.class));
        }

        @Test
        @DisplayName("Groups in order of first appearance")
        void testGroupBy() {
            List<Object> groups = query().groupBy("Status").toList();
            assertEquals(3, groups.size());
            DynamicClass first = (DynamicClass) groups.get(0);
            assertEquals(1, first.get("Key"));
            assertEquals(67, ((List<?>) first.get("Items")).size());
        }

        @Test
        @DisplayName("Aggregates over groups")
        void testGroupAggregates() {
            List<Object> totals = query().groupBy("Status")
                    .select("new(Key, Items.Count() as Total, Items.Max(ConferenceId) as Last)")
                    .toList();
            DynamicClass zero = (DynamicClass) totals.get(2);
            assertEquals(0, zero.get("Key"));
            assertEquals(66, zero.get("Total"));
            assertEquals(198, zero.get("Last"));
        }
    }

    @Nested
    @DisplayName("Paging and terminals")
    class Terminals {

        @Test
        @DisplayName("Skip and take page through the sequence")
        void testSkipTake() {
            List<Integer> ids = query().orderBy("ConferenceId").skip(20).take(5)
                    .select("ConferenceId").toList(Integer.class);
            assertEquals(List.of(21, 22, 23, 24, 25), ids);
            assertEquals(0, query().skip(500).count());
        }

        @Test
        @DisplayName("Negative counts are rejected")
        void testNegative() {
            assertThrows(IllegalArgumentException.class, () -> query().skip(-1));
            assertThrows(IllegalArgumentException.class, () -> query().take(-1));
        }

        @Test
        @DisplayName("Any and count with predicates")
        void testAnyCount() {
            assertTrue(query().any("ParticipantsNum == 49"));
            assertFalse(query().any("ParticipantsNum > 49"));
            assertEquals(67, query().count("Status == 1"));
        }
    }
}

package org.ccwonline.management.query;

import org.ccwonline.management.model.Conference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Query Tests")
class QueryTest {

    private static final List<Conference> CONFERENCES = List.of(
            new Conference(1, "Alpha", 10, 1),
            new Conference(2, "Beta", 150, 0),
            new Conference(3, "Gamma", 200, 1),
            new Conference(4, "Delta", 5, 2));

    private static List<Integer> filter(Query<Conference> query) {
        Predicate<Conference> predicate = query.predicate(Conference.class);
        return CONFERENCES.stream().filter(predicate).map(Conference::conferenceId).toList();
    }

    @Nested
    @DisplayName("Textual filters")
    class TextualFilters {

        @Test
        @DisplayName("Joined clauses renumber their placeholders")
        void testRenumbering() {
            Query<Conference> query = new Query<Conference>("ConferenceId < @0", 4).whereAnd("Status = @0", 1);
            assertEquals("(ConferenceId < @0) and (Status = @1)", query.whereString());
            assertEquals(List.of(4, 1), Arrays.asList(query.whereValues()));
            assertEquals(List.of(1, 3), filter(query));
        }

        @Test
        @DisplayName("Brace placeholders are renumbered as well")
        void testBracePlaceholders() {
            Query<Conference> query = new Query<Conference>("Status = {0}", 0).whereOr("ParticipantsNum < {0}", 6);
            assertEquals("(Status = {0}) or (ParticipantsNum < @1)", query.whereString());
            assertEquals(List.of(2, 4), filter(query));
        }

        @Test
        @DisplayName("Placeholders inside string literals are left alone")
        void testStringLiteral() {
            assertEquals("Name == \"@0\" and Status == @3", Placeholders.renumber("Name == \"@0\" and Status == @0", 3));
        }

        @Test
        @DisplayName("A trailing map supplies named values")
        void testNamedValues() {
            Query<Conference> query = new Query<>("ParticipantsNum >= min", Map.of("min", 150));
            assertEquals(1, query.whereValues().length);
            assertEquals(List.of(2, 3), filter(query));
        }

        @Test
        @DisplayName("whereAnd on an empty query starts the filter")
        void testFirstClause() {
            Query<Conference> query = new Query<Conference>().whereAnd("Status == 2");
            assertEquals("Status == 2", query.whereString());
            assertEquals(List.of(4), filter(query));
        }

        @Test
        @DisplayName("An empty query has no predicate")
        void testEmpty() {
            assertNull(new Query<Conference>().predicate(Conference.class));
            assertNull(new Query<Conference>().comparator(Conference.class));
        }
    }

    @Nested
    @DisplayName("Typed filters")
    class TypedFilters {

        @Test
        @DisplayName("A typed filter takes precedence over text")
        void testPrecedence() {
            Query<Conference> query = new Query<Conference>("Status == 1").where(c -> c.conferenceId() == 2);
            assertEquals(List.of(2), filter(query));
        }

        @Test
        @DisplayName("Typed clauses compose")
        void testCompose() {
            Query<Conference> query = new Query<Conference>(c -> c.status() == 1)
                    .whereAnd(c -> c.participantsNum() > 100)
                    .whereOr(c -> c.conferenceId() == 4);
            assertEquals(List.of(3, 4), filter(query));
        }
    }

    @Nested
    @DisplayName("Ordering and limit")
    class OrderingAndLimit {

        @Test
        @DisplayName("Typed ordering with a descending secondary key")
        void testTypedOrdering() {
            Query<Conference> query = new Query<>();
            query.orderBy(Conference::status).thenByDescending(Conference::conferenceId);
            List<Conference> sorted = new ArrayList<>(CONFERENCES);
            sorted.sort(query.comparator(Conference.class));
            assertEquals(List.of(2, 3, 1, 4), sorted.stream().map(Conference::conferenceId).toList());
        }

        @Test
        @DisplayName("Null keys sort first ascending and last descending")
        void testNullKeys() {
            List<String> names = new ArrayList<>(Arrays.asList("b", null, "a"));
            names.sort(OrderByClause.<String>by(s -> s).comparator());
            assertEquals(Arrays.asList(null, "a", "b"), names);
            names.sort(OrderByClause.<String>byDescending(s -> s).comparator());
            assertEquals(Arrays.asList("b", "a", null), names);
        }

        @Test
        @DisplayName("Textual ordering is used when no typed ordering is set")
        void testTextualOrdering() {
            Query<Conference> query = new Query<Conference>().orderBy("ParticipantsNum desc");
            List<Conference> sorted = new ArrayList<>(CONFERENCES);
            sorted.sort(query.comparator(Conference.class));
            assertEquals(List.of(3, 2, 1, 4), sorted.stream().map(Conference::conferenceId).toList());
        }

        @Test
        @DisplayName("Limit must not be negative")
        void testLimit() {
            assertEquals(5, new Query<Conference>().limit(5).limit());
            assertNull(new Query<Conference>().limit());
            assertThrows(IllegalArgumentException.class, () -> new Query<Conference>().limit(-1));
        }
    }
}

package org.ccwonline.management.filter;

import org.ccwonline.management.model.Conference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterExpression Tests")
class FilterExpressionTest {

    private static final List<Conference> CONFERENCES = List.of(
            new Conference(1, "Alpha", 10, 1),
            new Conference(2, "Beta", 150, 0),
            new Conference(3, "Gamma", 200, 1),
            new Conference(4, "Delta", 5, 2));

    private static List<Integer> ids(FilterExpression<Conference> filter) {
        return CONFERENCES.stream().filter(filter::test).map(Conference::conferenceId).toList();
    }

    @Test
    @DisplayName("An empty filter matches everything")
    void testEmpty() {
        FilterExpression<Conference> filter = new FilterExpression<>();
        assertTrue(filter.isEmpty());
        assertNull(filter.expression());
        assertEquals(List.of(1, 2, 3, 4), ids(filter));
    }

    @Test
    @DisplayName("Clauses combine left to right")
    void testLeftToRight() {
        FilterExpression<Conference> filter = new FilterExpression<Conference>()
                .start(c -> c.status() == 1)
                .and(c -> c.participantsNum() > 100)
                .or(c -> c.conferenceId() == 4);
        assertEquals(List.of(3, 4), ids(filter));
    }

    @Test
    @DisplayName("A false condition skips the clause")
    void testConditional() {
        String keyword = null;
        FilterExpression<Conference> filter = new FilterExpression<Conference>()
                .start(c -> c.status() == 1)
                .and(c -> c.name().contains(keyword), keyword != null)
                .or(c -> c.participantsNum() > 100, false);
        assertEquals(List.of(1, 3), ids(filter));
    }

    @Test
    @DisplayName("A false start clears earlier clauses")
    void testStartClears() {
        FilterExpression<Conference> filter = new FilterExpression<Conference>(c -> c.status() == 1)
                .start(c -> c.status() == 0, false);
        assertTrue(filter.isEmpty());
    }

    @Test
    @DisplayName("The first applied clause seeds an empty filter")
    void testFirstClause() {
        Predicate<Conference> predicate = new FilterExpression<Conference>()
                .or(c -> c.name().startsWith("D"))
                .expression();
        assertNotNull(predicate);
        assertEquals(List.of(4), ids(new FilterExpression<>(predicate)));
    }

    @Test
    @DisplayName("Null predicates are rejected")
    void testNullPredicate() {
        assertThrows(NullPointerException.class, () -> new FilterExpression<Conference>().and(null));
    }
}

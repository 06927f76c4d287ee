package org.ccwonline.management.repository;

import org.ccwonline.management.model.Conference;
import org.ccwonline.management.model.ConferenceRepository;
import org.ccwonline.management.query.Query;
import org.ccwonline.management.query.OrderByClause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GenericRepository Tests")
class GenericRepositoryTest {

    private ConferenceRepository repository;

    @BeforeEach
    void setUp() {
        repository = ConferenceRepository.inMemory();
        for (int id = 1; id <= 50; id++) {
            repository.create(new Conference(id, "Conference " + id, id * 10, id % 2));
        }
    }

    private static List<Integer> ids(List<Conference> conferences) {
        return conferences.stream().map(Conference::conferenceId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Create rejects a duplicate key")
        void testDuplicate() {
            assertThrows(RepositoryException.class, () -> repository.create(new Conference(1, "Again", 0, 0)));
            assertEquals(50, repository.count());
        }

        @Test
        @DisplayName("Update replaces the stored entity")
        void testUpdate() {
            Conference updated = repository.findById(7).withParticipantsNum(999);
            repository.update(updated);
            assertEquals(999, repository.findById(7).participantsNum());
        }

        @Test
        @DisplayName("Update of a missing entity fails")
        void testUpdateMissing() {
            assertThrows(RepositoryException.class, () -> repository.update(new Conference(500, "Nope", 0, 0)));
        }

        @Test
        @DisplayName("Delete by entity")
        void testDeleteEntity() {
            assertTrue(repository.delete(repository.findById(3)));
            assertFalse(repository.delete(new Conference(3, "Gone", 0, 0)));
            assertNull(repository.findById(3));
        }

        @Test
        @DisplayName("Delete by predicate returns the number removed")
        void testDeleteWhere() {
            assertEquals(10, repository.delete("ConferenceId > @0", 40));
            assertEquals(40, repository.count());
            assertEquals(20, repository.delete(c -> c.status() == 0));
            assertEquals(0, repository.delete("ConferenceId > 1000"));
        }

        @Test
        @DisplayName("Delete by predicate keeps an entity changed while matching")
        void testDeleteWhereIsAtomic() {
            ConferenceRepository small = ConferenceRepository.inMemory();
            small.create(new Conference(1, "One", 10, 1));
            small.create(new Conference(2, "Two", 20, 1));
            small.create(new Conference(3, "Three", 30, 0));

            boolean[] changed = {false};
            int deleted = small.delete(c -> {
                if (!changed[0]) {
                    changed[0] = true;
                    small.update(small.findById(2).withStatus(9));
                }
                return c.status() == 1;
            });

            assertEquals(1, deleted);
            assertNull(small.findById(1));
            assertEquals(9, small.findById(2).status());
            assertEquals(2, small.count());
        }
    }

    @Nested
    @DisplayName("Single results")
    class SingleResults {

        @Test
        @DisplayName("findOne returns the only match")
        void testFindOne() {
            assertEquals("Conference 48", repository.findOne("ConferenceId == @0", 48).name());
            assertNull(repository.findOne("ConferenceId == 0"));
        }

        @Test
        @DisplayName("findOne rejects several matches")
        void testNonUnique() {
            NonUniqueResultException e = assertThrows(NonUniqueResultException.class,
                    () -> repository.findOne("ConferenceId <= 3"));
            assertEquals("More than one Conference matches", e.getMessage());
        }

        @Test
        @DisplayName("findOne stops after the second match")
        void testFindOneStopsEarly() {
            int[] calls = {0};
            assertThrows(NonUniqueResultException.class, () -> repository.findOne(c -> {
                calls[0]++;
                return true;
            }));
            assertEquals(2, calls[0]);
        }

        @Test
        @DisplayName("isExist stops at the first match")
        void testIsExistStopsEarly() {
            int[] calls = {0};
            assertTrue(repository.isExist(c -> {
                calls[0]++;
                return c.conferenceId() == 1;
            }));
            assertEquals(1, calls[0]);
        }

        @Test
        @DisplayName("Count and existence")
        void testCountAndExist() {
            assertEquals(25, repository.count("Status == 1"));
            assertEquals(5, repository.count(c -> c.participantsNum() > 450));
            assertTrue(repository.isExist("Name.Contains(\"49\")"));
            assertFalse(repository.isExist(c -> c.conferenceId() > 50));
        }
    }

    @Nested
    @DisplayName("Collections")
    class Collections {

        @Test
        @DisplayName("findAll streams every entity")
        void testFindAll() {
            assertEquals(50, repository.findAll().count());
        }

        @Test
        @DisplayName("findAll with a typed ordering")
        void testOrderBy() {
            List<Conference> result = repository.findAll(c -> c.conferenceId() <= 4,
                    OrderByClause.<Conference>by(Conference::status).thenByDescending(Conference::conferenceId));
            assertEquals(List.of(4, 2, 3, 1), ids(result));
        }

        @Test
        @DisplayName("findAll with a query applies the limit after ordering")
        void testQueryLimit() {
            Query<Conference> query = new Query<Conference>("ConferenceId < @0", 20).whereAnd("Status == @0", 1);
            query.orderBy("ConferenceId desc");
            query.limit(3);
            assertEquals(List.of(19, 17, 15), ids(repository.findAll(query)));
        }

        @Test
        @DisplayName("Paging reports the total across pages")
        void testPaging() {
            Query<Conference> query = new Query<Conference>("Status == 0").limit(1);
            query.orderBy(Conference::conferenceId);
            Page<Conference> page = repository.findAll(query, 3, 10);
            assertEquals(25, page.totalCount());
            assertEquals(3, page.pageCount());
            assertFalse(page.hasNext());
            assertEquals(List.of(42, 44, 46, 48, 50), ids(page.items()));
        }

        @Test
        @DisplayName("Page arguments are validated")
        void testPagingArguments() {
            Query<Conference> query = new Query<>();
            assertThrows(IllegalArgumentException.class, () -> repository.findAll(query, 0, 10));
            assertThrows(IllegalArgumentException.class, () -> repository.findAll(query, 1, -1));
            assertTrue(repository.findAll(query, 10, 10).items().isEmpty());
        }

        @Test
        @DisplayName("Raw SQL needs a relational store")
        void testSqlQueryUnsupported() {
            assertThrows(UnsupportedOperationException.class,
                    () -> repository.sqlQuery("SELECT * FROM Conference"));
        }
    }
}

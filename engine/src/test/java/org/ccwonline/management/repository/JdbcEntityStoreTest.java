package org.ccwonline.management.repository;

import org.ccwonline.management.model.Conference;
import org.ccwonline.management.model.ConferenceRepository;
import org.ccwonline.management.store.ConnectionFactory;
import org.ccwonline.management.store.EntityMapping;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the JDBC store against in-memory DuckDB.
 */
@DisplayName("JdbcEntityStore Tests")
class JdbcEntityStoreTest {

    private Connection connection;
    private JdbcEntityStore<Conference> store;

    @BeforeEach
    void setUp() throws SQLException {
        connection = ConnectionFactory.createInMemoryDuckDB();
        store = new JdbcEntityStore<>(connection, EntityMapping.of(Conference.class), 100).ensureTable();
        store.insert(new Conference(1, "Alpha", 10, 1, LocalDateTime.of(2024, 3, 2, 9, 0)));
        store.insert(new Conference(2, "Beta", 150, 0));
        store.insert(new Conference(3, "Gamma", 200, 1));
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (connection != null) {
            connection.close();
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("Inserted rows map back to equal entities")
        void testRoundTrip() {
            List<Conference> all = store.findAll();
            assertEquals(3, all.size());
            assertTrue(all.contains(new Conference(1, "Alpha", 10, 1, LocalDateTime.of(2024, 3, 2, 9, 0))));
            assertTrue(all.contains(new Conference(2, "Beta", 150, 0)));
        }

        @Test
        @DisplayName("Update reports whether a row matched")
        void testUpdate() {
            assertTrue(store.update(new Conference(2, "Beta", 151, 2)));
            assertFalse(store.update(new Conference(9, "Missing", 0, 0)));
            assertTrue(store.findAll().contains(new Conference(2, "Beta", 151, 2)));
        }

        @Test
        @DisplayName("Delete by key")
        void testDelete() {
            assertTrue(store.delete(new Conference(3, "ignored", 0, 0)));
            assertFalse(store.delete(new Conference(3, "ignored", 0, 0)));
            assertEquals(2, store.findAll().size());
        }

        @Test
        @DisplayName("Delete by predicate counts removed rows")
        void testDeleteWhere() {
            assertEquals(2, store.deleteWhere(c -> c.conferenceId() != 2));
            assertEquals(0, store.deleteWhere(c -> false));
            assertEquals(List.of(new Conference(2, "Beta", 150, 0)), store.findAll());
        }

        @Test
        @DisplayName("A failing predicate rolls back the delete")
        void testDeleteWhereRollback() throws SQLException {
            assertThrows(IllegalStateException.class, () -> store.deleteWhere(c -> {
                if (c.conferenceId() == 3) {
                    throw new IllegalStateException("boom");
                }
                return true;
            }));
            assertTrue(connection.getAutoCommit());
            assertEquals(3, store.count());
        }

        @Test
        @DisplayName("A failed write rolls back and keeps the driver error")
        void testRollback() throws SQLException {
            RepositoryException e = assertThrows(RepositoryException.class,
                    () -> store.insert(new Conference(1, "Duplicate", 0, 0)));
            assertInstanceOf(SQLException.class, e.getCause());
            assertTrue(connection.getAutoCommit());
            assertEquals(3, store.findAll().size());
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Raw SQL binds parameters and maps rows")
        void testSqlQuery() {
            List<Conference> result = store.sqlQuery(
                    "SELECT * FROM Conference WHERE ParticipantsNum < ? ORDER BY ConferenceId", 160);
            assertEquals(List.of(1, 2), result.stream().map(Conference::conferenceId).toList());
        }

        @Test
        @DisplayName("Missing columns take default values")
        void testPartialColumns() {
            List<Conference> result = store.sqlQuery("SELECT ConferenceId, Name FROM Conference WHERE ConferenceId = ?", 3);
            assertEquals(new Conference(3, "Gamma", 0, 0), result.get(0));
        }

        @Test
        @DisplayName("Invalid SQL surfaces as a repository error")
        void testInvalidSql() {
            assertThrows(RepositoryException.class, () -> store.sqlQuery("SELECT * FROM NoSuchTable"));
        }

        @Test
        @DisplayName("Counts use the database and predicate scans")
        void testCount() {
            assertEquals(3, store.count());
            assertEquals(2, store.count(c -> c.status() == 1));
            assertEquals(List.of(2, 3), store.findMatching(c -> c.participantsNum() > 100, 5).stream()
                    .map(Conference::conferenceId).sorted().toList());
            assertEquals(1, store.findMatching(c -> true, 1).size());
        }

        @Test
        @DisplayName("anyMatch stops reading rows at the first match")
        void testAnyMatchStopsEarly() {
            int[] calls = {0};
            assertTrue(store.anyMatch(c -> {
                calls[0]++;
                return true;
            }));
            assertEquals(1, calls[0]);
        }

        @Test
        @DisplayName("Dynamic predicates run over stored rows")
        void testRepositoryOverJdbc() {
            ConferenceRepository repository = new ConferenceRepository(store);
            assertEquals(2, repository.count("Status == 1"));
            assertEquals(150, repository.findOne("Name == @0", "Beta").participantsNum());
            assertEquals(1, repository.delete("StartTime != null"));
            assertEquals(2, repository.count());
        }
    }
}

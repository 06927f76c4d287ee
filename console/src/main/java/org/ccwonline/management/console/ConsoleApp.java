package org.ccwonline.management.console;

import org.ccwonline.management.model.Conference;
import org.ccwonline.management.model.ConferenceRepository;
import org.ccwonline.management.query.Query;
import org.ccwonline.management.repository.Page;
import org.ccwonline.management.store.ConnectionFactory;
import org.ccwonline.management.store.DataSourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Walks through the repository API against the {@code Conference} table.
 *
 * The database comes from {@code ccwonline.properties}; an empty table is seeded with
 * sample conferences first.
 */
public class ConsoleApp {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleApp.class);

    static final int SAMPLE_SIZE = 200;

    private final ConferenceRepository repository;
    private final PrintStream out;

    public ConsoleApp(ConferenceRepository repository, PrintStream out) {
        this.repository = repository;
        this.out = out;
    }

    public static void main(String[] args) throws SQLException {
        run(DataSourceConfig.load(), System.out);
    }

    /**
     * Opens the configured database, runs the walkthrough, then releases the connection.
     */
    static void run(DataSourceConfig config, PrintStream out) throws SQLException {
        logger.info("Using {}", config);
        Connection connection = new ConnectionFactory(config).open();
        try {
            new ConsoleApp(ConferenceRepository.jdbc(connection, config.fetchSize()), out).run();
        } finally {
            release(config, connection);
        }
    }

    /**
     * In-memory connections are owned by the factory cache; any other connection is closed.
     */
    static void release(DataSourceConfig config, Connection connection) throws SQLException {
        if (config.isInMemory()) {
            ConnectionFactory.clearCache();
        } else {
            connection.close();
        }
    }

    public void run() {
        if (repository.count() == 0) {
            seed(repository);
        }

        // Count
        out.println("Count: " + repository.count());

        // FindAll
        List<Conference> small = repository.findAll(c -> c.participantsNum() < 100, null);
        out.println("FindAll: " + small.size());

        // SqlQuery
        try {
            List<Conference> bySql = repository.sqlQuery("SELECT * FROM Conference WHERE ParticipantsNum < ?", 100);
            out.println("SqlQuery: " + bySql.size());
        } catch (UnsupportedOperationException e) {
            out.println("SqlQuery: not supported by this store");
        }

        // FindOne
        Conference conference = repository.findOne(c -> c.conferenceId() == 48);
        out.println("FindOne: " + conference.participantsNum());

        // Update
        repository.update(conference.withParticipantsNum(conference.participantsNum() + 1));
        Conference updated = repository.findOne("ConferenceId == @0", 48);
        out.println("FindOne: " + updated.participantsNum());

        // Delete
        repository.delete(c -> c.conferenceId() == 47);
        out.println("Count: " + repository.count());

        // FindAll Query And
        Query<Conference> query = new Query<>();
        query.where(c -> c.conferenceId() < 150 || c.name().contains("是"));
        query.whereAnd(c -> c.status() == 2);
        query.limit(3);
        out.println("FindAll Query: " + repository.findAll(query).size());

        // FindAll OrderBy ThenBy
        Query<Conference> ordered = new Query<>(c -> c.participantsNum() > 1);
        ordered.orderBy(Conference::status).thenByDescending(Conference::conferenceId);
        out.println("FindAll OrderBy: " + repository.findAll(ordered).size());

        // FindAll Paging
        Query<Conference> paged = new Query<>(c -> c.participantsNum() > 1);
        paged.orderBy(Conference::status).thenByDescending(Conference::conferenceId);
        Page<Conference> page = repository.findAll(paged, 10, 20);
        out.println("FindAll Paging: " + page.items().size() + " of " + page.totalCount());

        // FindAll DynamicQuery
        Query<Conference> dynamic = new Query<>("ConferenceId < 100");
        dynamic.whereAnd("Status = {0}", 1);
        dynamic.orderBy("ConferenceId DESC");
        out.println("FindAll DynamicQuery: " + repository.findAll(dynamic).size());
    }

    static void seed(ConferenceRepository repository) {
        LocalDateTime start = LocalDateTime.of(2024, 3, 1, 9, 0);
        for (int id = 1; id <= SAMPLE_SIZE; id++) {
            String name = id % 10 == 0 ? "这是会议 " + id : "Conference " + id;
            repository.create(new Conference(id, name, (id * 37) % 250, id % 3, start.plusDays(id)));
        }
        logger.info("Seeded {} conferences", SAMPLE_SIZE);
    }
}

package org.ccwonline.management.model;

import org.ccwonline.management.repository.EntityStore;
import org.ccwonline.management.repository.GenericRepository;
import org.ccwonline.management.repository.InMemoryEntityStore;
import org.ccwonline.management.repository.JdbcEntityStore;
import org.ccwonline.management.store.EntityMapping;

import java.sql.Connection;

public class ConferenceRepository extends GenericRepository<Conference> {

    public ConferenceRepository(EntityStore<Conference> store) {
        super(Conference.class, store);
    }

    public static ConferenceRepository inMemory() {
        return new ConferenceRepository(new InMemoryEntityStore<>(Conference::conferenceId));
    }

    /**
     * Creates a repository over the {@code Conference} table, creating the table if needed.
     */
    public static ConferenceRepository jdbc(Connection connection, int fetchSize) {
        return new ConferenceRepository(
                new JdbcEntityStore<>(connection, EntityMapping.of(Conference.class), fetchSize).ensureTable());
    }

    public Conference findById(int conferenceId) {
        return findOne(c -> c.conferenceId() == conferenceId);
    }
}

package com.chronoline.timeline.test;

import com.chronoline.timeline.core.dao.EventCategoryDao;
import com.chronoline.timeline.core.dao.EventDao;
import com.chronoline.timeline.core.dao.EventLocationDao;
import com.chronoline.timeline.core.dao.EventLocationRecord;
import com.chronoline.timeline.core.dao.EventRecord;
import com.chronoline.timeline.core.dao.EventSourceDao;
import com.chronoline.timeline.core.dao.EventSourceRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.UUID;

/**
 * Read-side helpers over the raw {@link Jdbi}, usable even while
 * {@code DatabaseService} is forced into FAILED.
 */
@ApplicationScoped
public class TestStore {

    @Inject
    Jdbi jdbi;

    public long eventCount() {
        return jdbi.withExtension(EventDao.class, EventDao::count);
    }

    public long sourceCount() {
        return jdbi.withHandle(h -> h.createQuery("SELECT COUNT(*) FROM event_sources")
                .mapTo(Long.class).one());
    }

    public List<EventRecord> eventsTitled(String title) {
        return jdbi.withExtension(EventDao.class, dao -> dao.findByTitle(title));
    }

    public EventRecord event(UUID id) {
        return jdbi.withExtension(EventDao.class, dao -> dao.findById(id)).orElseThrow();
    }

    public List<EventSourceRecord> sources(UUID eventId) {
        return jdbi.withExtension(EventSourceDao.class, dao -> dao.findByEvent(eventId));
    }

    public List<EventLocationRecord> locations(UUID eventId) {
        return jdbi.withExtension(EventLocationDao.class, dao -> dao.findByEvent(eventId));
    }

    public List<String> primaryCategories(UUID eventId) {
        return jdbi.withExtension(EventCategoryDao.class, dao -> dao.findPrimary(eventId));
    }
}

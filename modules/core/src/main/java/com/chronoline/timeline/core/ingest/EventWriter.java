package com.chronoline.timeline.core.ingest;

import com.chronoline.timeline.core.dao.EventCategoryDao;
import com.chronoline.timeline.core.dao.EventDao;
import com.chronoline.timeline.core.dao.EventLocationDao;
import com.chronoline.timeline.core.dao.EventSourceDao;
import com.chronoline.timeline.core.db.DatabaseService;
import com.chronoline.timeline.core.model.CandidateEvent;
import com.chronoline.timeline.core.model.CandidateSource;
import com.chronoline.timeline.util.GeoPoint;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes one event group (event, primary category link, sources, primary
 * location) in a single transaction. Any failure rolls back the whole group.
 */
@ApplicationScoped
public class EventWriter {

    private static final Logger log = Logger.getLogger(EventWriter.class);

    @Inject
    DatabaseService databaseService;

    /** Returns the number of source rows inserted. */
    public int write(UUID eventId, CandidateEvent event, String imageUrl,
                     List<CandidateSource> sources, String actor) {
        Instant now = Instant.now();
        return databaseService.jdbi().inTransaction(h -> {
            h.attach(EventDao.class).insert(eventId, event.title(), event.description(),
                    event.unixSeconds(), event.unixNanos(), event.precision(), event.category(),
                    event.importanceOrDefault(), imageUrl, actor, now);

            h.attach(EventCategoryDao.class).insertPrimary(eventId, event.category(), now);

            EventSourceDao sourceDao = h.attach(EventSourceDao.class);
            for (CandidateSource source : sources) {
                sourceDao.insert(UUID.randomUUID(), eventId, source.kind(), source.title(), source.url(),
                        source.citation(), source.credibility(), actor, now);
            }

            if (event.location().isPresent()) {
                GeoPoint point = event.location().get();
                h.attach(EventLocationDao.class).insertPrimary(UUID.randomUUID(), eventId,
                        event.locationNameOrDefault(), point.longitude(), point.latitude(),
                        point.toGeoJson(), now);
            }

            log.debugf("Wrote event %s (%s) with %d sources", eventId, event.title(), sources.size());
            return sources.size();
        });
    }
}

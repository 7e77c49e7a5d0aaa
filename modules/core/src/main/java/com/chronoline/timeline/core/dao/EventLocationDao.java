package com.chronoline.timeline.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RegisterConstructorMapper(EventLocationRecord.class)
public interface EventLocationDao {

    @SqlUpdate("INSERT INTO event_locations (id, event_id, location_name, location_type, " +
            "longitude, latitude, geojson, is_primary, created_at) " +
            "VALUES (:id, :eventId, :name, 'primary', :longitude, :latitude, :geojson, TRUE, :now)")
    void insertPrimary(@Bind("id") UUID id,
                       @Bind("eventId") UUID eventId,
                       @Bind("name") String name,
                       @Bind("longitude") double longitude,
                       @Bind("latitude") double latitude,
                       @Bind("geojson") String geojson,
                       @Bind("now") Instant now);

    @SqlQuery("SELECT id, event_id, location_name, location_type, longitude, latitude, geojson, is_primary " +
            "FROM event_locations WHERE event_id = :eventId")
    List<EventLocationRecord> findByEvent(@Bind("eventId") UUID eventId);
}

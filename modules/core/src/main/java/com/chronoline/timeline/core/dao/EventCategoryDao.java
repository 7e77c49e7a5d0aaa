package com.chronoline.timeline.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface EventCategoryDao {

    @SqlUpdate("INSERT INTO event_categories (event_id, category_id, is_primary, created_at) " +
            "VALUES (:eventId, :categoryId, TRUE, :now)")
    void insertPrimary(@Bind("eventId") UUID eventId,
                       @Bind("categoryId") String categoryId,
                       @Bind("now") Instant now);

    @SqlQuery("SELECT category_id FROM event_categories WHERE event_id = :eventId AND is_primary = TRUE")
    List<String> findPrimary(@Bind("eventId") UUID eventId);
}

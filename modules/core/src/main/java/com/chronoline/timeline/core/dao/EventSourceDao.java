package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.SourceKind;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RegisterColumnMapper(SourceKindColumnMapper.class)
@RegisterArgumentFactory(SourceKindArgumentFactory.class)
@RegisterConstructorMapper(EventSourceRecord.class)
public interface EventSourceDao {

    @SqlUpdate("INSERT INTO event_sources (id, event_id, source_type, title, url, citation, " +
            "credibility_score, added_by, created_at) " +
            "VALUES (:id, :eventId, :sourceType, :title, :url, :citation, :credibility, :addedBy, :now)")
    void insert(@Bind("id") UUID id,
                @Bind("eventId") UUID eventId,
                @Bind("sourceType") SourceKind sourceType,
                @Bind("title") String title,
                @Bind("url") String url,
                @Bind("citation") String citation,
                @Bind("credibility") int credibility,
                @Bind("addedBy") String addedBy,
                @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM event_sources WHERE event_id = :eventId ORDER BY created_at, id")
    List<EventSourceRecord> findByEvent(@Bind("eventId") UUID eventId);
}

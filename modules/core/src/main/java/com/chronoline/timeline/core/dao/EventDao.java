package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.PrecisionLevel;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterColumnMapper(PrecisionLevelColumnMapper.class)
@RegisterArgumentFactory(PrecisionLevelArgumentFactory.class)
@RegisterConstructorMapper(EventRecord.class)
public interface EventDao {

    @SqlUpdate("INSERT INTO events (id, title, description, unix_seconds, unix_nanos, precision_level, " +
            "category, importance_score, image_url, created_by, created_at, updated_at) " +
            "VALUES (:id, :title, :description, :unixSeconds, :unixNanos, :precision, " +
            ":category, :importance, :imageUrl, :createdBy, :now, :now)")
    void insert(@Bind("id") UUID id,
                @Bind("title") String title,
                @Bind("description") String description,
                @Bind("unixSeconds") long unixSeconds,
                @Bind("unixNanos") int unixNanos,
                @Bind("precision") PrecisionLevel precision,
                @Bind("category") String category,
                @Bind("importance") int importance,
                @Bind("imageUrl") String imageUrl,
                @Bind("createdBy") String createdBy,
                @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM events WHERE id = :id")
    Optional<EventRecord> findById(@Bind("id") UUID id);

    @SqlQuery("SELECT * FROM events WHERE title = :title ORDER BY created_at")
    List<EventRecord> findByTitle(@Bind("title") String title);

    @SqlQuery("SELECT COUNT(*) FROM events")
    long count();
}

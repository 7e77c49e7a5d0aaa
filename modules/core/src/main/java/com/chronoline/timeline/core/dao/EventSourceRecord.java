package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.SourceKind;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record EventSourceRecord(
        @ColumnName("id") UUID id,
        @ColumnName("event_id") UUID eventId,
        @ColumnName("source_type") SourceKind sourceType,
        @ColumnName("title") String title,
        @ColumnName("url") String url,
        @ColumnName("citation") String citation,
        @ColumnName("credibility_score") int credibilityScore,
        @ColumnName("added_by") String addedBy,
        @ColumnName("created_at") Instant createdAt
) {}

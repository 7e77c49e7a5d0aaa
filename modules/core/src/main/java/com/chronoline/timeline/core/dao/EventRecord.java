package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.PrecisionLevel;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record EventRecord(
        @ColumnName("id") UUID id,
        @ColumnName("title") String title,
        @ColumnName("description") String description,
        @ColumnName("unix_seconds") long unixSeconds,
        @ColumnName("unix_nanos") int unixNanos,
        @ColumnName("precision_level") PrecisionLevel precisionLevel,
        @ColumnName("category") String category,
        @ColumnName("importance_score") int importanceScore,
        @ColumnName("image_url") String imageUrl,
        @ColumnName("created_by") String createdBy,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {}

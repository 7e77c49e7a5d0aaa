package com.chronoline.timeline.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.util.UUID;

public record EventLocationRecord(
        @ColumnName("id") UUID id,
        @ColumnName("event_id") UUID eventId,
        @ColumnName("location_name") String locationName,
        @ColumnName("location_type") String locationType,
        @ColumnName("longitude") double longitude,
        @ColumnName("latitude") double latitude,
        @ColumnName("geojson") String geojson,
        @ColumnName("is_primary") boolean primary
) {}

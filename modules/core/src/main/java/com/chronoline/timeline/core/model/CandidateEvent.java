package com.chronoline.timeline.core.model;

import com.chronoline.timeline.types.PrecisionLevel;
import com.chronoline.timeline.util.Coercion;
import com.chronoline.timeline.util.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed view of a candidate event that passed validation. Sources stay raw
 * because each one is re-validated at insert time.
 */
public record CandidateEvent(
        String title,
        long unixSeconds,
        int unixNanos,
        PrecisionLevel precision,
        GeoPoint point,
        String category,
        String description,
        Integer importance,
        String imageUrl,
        String locationName,
        List<JsonNode> sources
) {

    public static final int DEFAULT_IMPORTANCE = 50;
    public static final String DEFAULT_LOCATION_NAME = "Unknown";

    public CandidateEvent {
        sources = List.copyOf(sources);
    }

    /**
     * Converts a raw event. Only valid for input that passed
     * {@link com.chronoline.timeline.core.validate.EventValidator}.
     */
    public static CandidateEvent from(JsonNode event) {
        GeoPoint point = new GeoPoint(
                Coercion.toDouble(event.get("latitude")).orElseThrow(),
                Coercion.toDouble(event.get("longitude")).orElseThrow());

        List<JsonNode> sources = new ArrayList<>();
        JsonNode rawSources = event.get("sources");
        if (rawSources != null && rawSources.isArray()) {
            rawSources.forEach(sources::add);
        }

        return new CandidateEvent(
                event.get("title").textValue().trim(),
                Coercion.toLong(event.get("unix_seconds")).orElseThrow(),
                (int) Coercion.toLong(event.get("unix_nanos")).orElse(0L),
                PrecisionLevel.requireLabel(event.get("precision_level").textValue()),
                point,
                event.get("category").textValue().trim(),
                Coercion.nonBlankText(event.get("description")).orElse(null),
                Coercion.toBoundedInt(event.get("importance_score"), 0, 100)
                        .map(Coercion.RangeCheck::intValue)
                        .orElse(null),
                Coercion.verbatimText(event.get("image_url")).orElse(null),
                Coercion.nonBlankText(event.get("location_name")).orElse(null),
                sources);
    }

    public Optional<GeoPoint> location() {
        return Optional.ofNullable(point);
    }

    public Optional<String> suppliedImage() {
        return Optional.ofNullable(imageUrl);
    }

    public int importanceOrDefault() {
        return importance != null ? importance : DEFAULT_IMPORTANCE;
    }

    public String locationNameOrDefault() {
        return locationName != null ? locationName : DEFAULT_LOCATION_NAME;
    }
}

package com.chronoline.timeline.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * WGS84 point. Stored and serialized in GeoJSON order: longitude first.
 */
public record GeoPoint(double latitude, double longitude) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public GeoPoint {
        if (!isValidLatitude(latitude)) {
            throw new IllegalArgumentException("latitude must be between -90 and 90, got " + latitude);
        }
        if (!isValidLongitude(longitude)) {
            throw new IllegalArgumentException("longitude must be between -180 and 180, got " + longitude);
        }
    }

    public static boolean isValidLatitude(double latitude) {
        return latitude >= -90.0 && latitude <= 90.0;
    }

    public static boolean isValidLongitude(double longitude) {
        return longitude >= -180.0 && longitude <= 180.0;
    }

    /** {@code {"type":"Point","coordinates":[lon,lat]}} */
    public String toGeoJson() {
        ObjectNode point = MAPPER.createObjectNode();
        point.put("type", "Point");
        point.putArray("coordinates").add(longitude).add(latitude);
        return point.toString();
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}

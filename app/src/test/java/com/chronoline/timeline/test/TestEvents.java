package com.chronoline.timeline.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;

/**
 * Builds valid candidate events; tests then break the one field they care about.
 */
public final class TestEvents {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private TestEvents() {}

    /** Unique title so assertions are not disturbed by other tests sharing the store. */
    public static String uniqueTitle(String base) {
        return base + " #" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static ObjectNode event(String title) {
        ObjectNode event = MAPPER.createObjectNode();
        event.put("title", title);
        event.put("unix_seconds", -5694969600L);
        event.put("precision_level", "day");
        event.put("latitude", 48.8532);
        event.put("longitude", 2.3692);
        event.put("category", "revolution_uprising");
        return event;
    }

    public static ObjectNode source(String url, String title) {
        ObjectNode source = MAPPER.createObjectNode();
        if (url != null) {
            source.put("url", url);
        }
        if (title != null) {
            source.put("title", title);
        }
        return source;
    }
}

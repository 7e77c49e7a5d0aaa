package com.chronoline.timeline.loaders.json;

import com.chronoline.timeline.loaders.api.EventLoader;
import com.chronoline.timeline.loaders.api.LoadException;
import com.chronoline.timeline.loaders.api.LoaderCriteria;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Loads either a bare JSON array of events or an envelope {@code {"events": [...]}}.
 */
@ApplicationScoped
public class JsonEventLoader implements EventLoader {

    private static final Logger log = Logger.getLogger(JsonEventLoader.class);

    static final String ENVELOPE_KEY = "events";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public LoaderCriteria getCriteria() {
        return new LoaderCriteria(
                Set.of("application/json"),
                Set.of("json"),
                100
        );
    }

    @Override
    public List<JsonNode> load(InputStream in) {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new LoadException("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LoadException("Failed to read JSON input", e);
        }
        return fromTree(root);
    }

    /** Unwraps an already-parsed document. */
    public List<JsonNode> fromTree(JsonNode root) {
        JsonNode array;
        if (root != null && root.isArray()) {
            array = root;
        } else if (root != null && root.isObject() && root.has(ENVELOPE_KEY)) {
            array = root.get(ENVELOPE_KEY);
            if (!array.isArray()) {
                throw new LoadException("'" + ENVELOPE_KEY + "' must be an array");
            }
        } else {
            throw new LoadException("Invalid JSON format. Expected '" + ENVELOPE_KEY + "' key or array");
        }

        List<JsonNode> events = new ArrayList<>(array.size());
        array.forEach(events::add);
        log.debugf("Loaded %d events from JSON", events.size());
        return events;
    }
}

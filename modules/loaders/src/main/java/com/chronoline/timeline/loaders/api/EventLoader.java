package com.chronoline.timeline.loaders.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.InputStream;
import java.util.List;

/**
 * Reads a producer's file into candidate events, one loosely typed JSON node per event.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 * <p>
 * Loaders reshape input only. They never validate field values: an element that
 * is not even an object is passed through for the validator to reject.
 */
public interface EventLoader {

    LoaderCriteria getCriteria();

    /**
     * @throws LoadException if the input cannot be parsed or has the wrong overall shape
     */
    List<JsonNode> load(InputStream in);
}

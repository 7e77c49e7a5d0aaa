package com.chronoline.timeline.loaders.csv;

import com.chronoline.timeline.loaders.api.EventLoader;
import com.chronoline.timeline.loaders.api.LoadException;
import com.chronoline.timeline.loaders.api.LoaderCriteria;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads row-grouped tabular input. Each row carries the event columns plus at most
 * one source; rows sharing a title fold into one event, in first-seen order, whose
 * event fields come from the first row.
 *
 * <p>Blank cells are treated as absent. Rows with a blank title are skipped.
 */
@ApplicationScoped
public class CsvEventLoader implements EventLoader {

    private static final Logger log = Logger.getLogger(CsvEventLoader.class);

    /** Event columns copied verbatim under the same key. */
    static final List<String> EVENT_COLUMNS = List.of(
            "unix_seconds", "unix_nanos", "precision_level", "description", "category",
            "importance_score", "image_url", "latitude", "longitude", "location_name");

    /** Source columns and the source key each maps to. */
    static final Map<String, String> SOURCE_COLUMNS = Map.of(
            "source_url", "url",
            "source_title", "title",
            "source_type", "source_type",
            "source_citation", "citation",
            "credibility_score", "credibility_score");

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public LoaderCriteria getCriteria() {
        return new LoaderCriteria(
                Set.of("text/csv", "application/csv"),
                Set.of("csv"),
                100
        );
    }

    @Override
    public List<JsonNode> load(InputStream in) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Map<String, ObjectNode> byTitle = new LinkedHashMap<>();
        int skippedRows = 0;

        try (MappingIterator<Map<String, String>> rows =
                     mapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                String title = cell(row, "title");
                if (title == null) {
                    skippedRows++;
                    continue;
                }

                ObjectNode event = byTitle.computeIfAbsent(title, t -> newEvent(t, row));
                ObjectNode source = sourceOf(row);
                if (source != null) {
                    ((ArrayNode) event.get("sources")).add(source);
                }
            }
        } catch (IOException e) {
            throw new LoadException("Failed to read CSV input", e);
        } catch (RuntimeJsonMappingException e) {
            throw new LoadException("CSV parsing error: " + e.getMessage(), e);
        }

        if (skippedRows > 0) {
            log.warnf("Skipped %d CSV rows with empty title", skippedRows);
        }
        log.debugf("Loaded %d events from CSV", byTitle.size());
        return new ArrayList<>(byTitle.values());
    }

    private static ObjectNode newEvent(String title, Map<String, String> row) {
        ObjectNode event = JsonNodeFactory.instance.objectNode();
        event.put("title", title);
        for (String column : EVENT_COLUMNS) {
            String value = cell(row, column);
            if (value != null) {
                event.put(column, value);
            }
        }
        event.putArray("sources");
        return event;
    }

    private static ObjectNode sourceOf(Map<String, String> row) {
        if (cell(row, "source_url") == null && cell(row, "source_title") == null) {
            return null;
        }
        ObjectNode source = JsonNodeFactory.instance.objectNode();
        SOURCE_COLUMNS.forEach((column, key) -> {
            String value = cell(row, column);
            if (value != null) {
                source.put(key, value);
            }
        });
        return source;
    }

    private static String cell(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null) return null;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }
}

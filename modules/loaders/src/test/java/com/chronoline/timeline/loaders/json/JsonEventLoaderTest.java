package com.chronoline.timeline.loaders.json;

import com.chronoline.timeline.loaders.api.LoadException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JsonEventLoaderTest {

    private final JsonEventLoader loader = new JsonEventLoader();

    @Test
    void shouldLoadBareArray() {
        List<JsonNode> events = loader.load(stream("""
                [{"title": "Storming of the Bastille"}, {"title": "Fall of the Berlin Wall"}]
                """));

        assertThat(events).hasSize(2);
        assertThat(events.get(0).get("title").asText()).isEqualTo("Storming of the Bastille");
    }

    @Test
    void shouldUnwrapEventsEnvelope() {
        List<JsonNode> events = loader.load(stream("""
                {"source": "wikidata", "events": [{"title": "Moon landing", "unix_seconds": -14182940}]}
                """));

        assertThat(events).hasSize(1);
        assertThat(events.get(0).get("unix_seconds").asLong()).isEqualTo(-14182940L);
    }

    @Test
    void shouldPassNonObjectElementsThrough() {
        List<JsonNode> events = loader.load(stream("[42, \"text\", {\"title\": \"x\"}]"));

        assertThat(events).hasSize(3);
        assertThat(events.get(0).isNumber()).isTrue();
    }

    @Test
    void shouldRejectObjectWithoutEnvelope() {
        assertThatThrownBy(() -> loader.load(stream("{\"title\": \"lonely\"}")))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("events");
    }

    @Test
    void shouldRejectEnvelopeWithNonArrayEvents() {
        assertThatThrownBy(() -> loader.load(stream("{\"events\": {\"title\": \"x\"}}")))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("must be an array");
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> loader.load(stream("[{\"title\": ")))
                .isInstanceOf(LoadException.class)
                .hasMessageStartingWith("Invalid JSON");
    }

    @Test
    void shouldDetectJsonFiles() {
        assertThat(loader.getCriteria().matches(null, "events.json")).isTrue();
        assertThat(loader.getCriteria().matches("application/json", null)).isTrue();
        assertThat(loader.getCriteria().matches(null, "events.csv")).isFalse();
    }

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}

package com.chronoline.timeline.test;

import com.chronoline.timeline.core.category.JdbiCategoryRegistry;
import com.chronoline.timeline.core.db.DatabaseService;
import com.chronoline.timeline.core.service.ManagedService;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static com.chronoline.timeline.test.TestEvents.event;
import static com.chronoline.timeline.test.TestEvents.uniqueTitle;
import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class IngestResourceTest {

    @Inject
    TestStore store;

    @Inject
    DatabaseService databaseService;

    @Inject
    JdbiCategoryRegistry categoryRegistry;

    @AfterEach
    void restore() {
        databaseService.forceState(ManagedService.State.RUNNING);
        categoryRegistry.forceState(ManagedService.State.RUNNING);
    }

    @Test
    void ingestsJsonArray() {
        String title = uniqueTitle("Storming of the Bastille");
        String body = "[" + event(title) + ", " + event(uniqueTitle("Bad")).put("longitude", 500) + "]";

        given()
                .contentType(ContentType.JSON)
                .body(body)
                .queryParam("actor", "rest-test")
                .when().post("/api/ingest/events")
                .then()
                .statusCode(200)
                .body("aborted", is(false))
                .body("eventsCreated", is(1))
                .body("eventsSkipped", is(1))
                .body("structuralRejects", is(1))
                .body("errors", hasSize(1))
                .body("errors[0]", containsString("longitude"))
                .body("moreErrors", is(0));

        assertThat(store.eventsTitled(title)).singleElement()
                .satisfies(e -> assertThat(e.createdBy()).isEqualTo("rest-test"));
    }

    @Test
    void ingestsJsonEnvelope() {
        String title = uniqueTitle("Apollo 11");
        String body = "{\"events\": [" + event(title).put("category", "space_exploration") + "]}";

        given()
                .contentType(ContentType.JSON)
                .body(body)
                .when().post("/api/ingest/events")
                .then()
                .statusCode(200)
                .body("eventsCreated", is(1))
                .body("fallbacksApplied", is(1));
    }

    @Test
    void dryRunReportsWithoutWriting() {
        String title = uniqueTitle("Dry run");

        given()
                .contentType(ContentType.JSON)
                .body("[" + event(title) + "]")
                .queryParam("dryRun", true)
                .when().post("/api/ingest/events")
                .then()
                .statusCode(200)
                .body("eventsCreated", is(0))
                .body("dryRunAccepted", is(1));

        assertThat(store.eventsTitled(title)).isEmpty();
    }

    @Test
    void skipsDuplicateTitlesOnRequest() {
        String title = uniqueTitle("Duplicate");

        given()
                .contentType(ContentType.JSON)
                .body("[" + event(title) + ", " + event(title) + "]")
                .queryParam("skipDuplicateTitles", true)
                .when().post("/api/ingest/events")
                .then()
                .statusCode(200)
                .body("eventsCreated", is(1))
                .body("duplicatesSkipped", is(1));
    }

    @Test
    void ingestsCsv() {
        String title = uniqueTitle("Fall of the Berlin Wall");
        String csv = "title,unix_seconds,precision_level,category,latitude,longitude,source_url,source_type\n"
                + title + ",626572800,day,revolution_uprising,52.5163,13.3777,https://www.wikidata.org/wiki/Q5699,wikidata\n"
                + title + ",626572800,day,revolution_uprising,52.5163,13.3777,https://en.wikipedia.org/wiki/Berlin_Wall,wikipedia\n";

        given()
                .contentType("text/csv")
                .body(csv)
                .when().post("/api/ingest/events")
                .then()
                .statusCode(200)
                .body("eventsCreated", is(1))
                .body("sourcesCreated", is(2));
    }

    @Test
    void malformedJsonIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body("[{\"title\": ")
                .when().post("/api/ingest/events")
                .then()
                .statusCode(400)
                .body("error", containsString("Invalid JSON"));
    }

    @Test
    void wrongShapeIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"title\": \"not wrapped\"}")
                .when().post("/api/ingest/events")
                .then()
                .statusCode(400)
                .body("error", containsString("events"));
    }

    @Test
    void registryOutageIsServiceUnavailable() {
        categoryRegistry.fail(new RuntimeException("simulated registry outage"));

        given()
                .contentType(ContentType.JSON)
                .body("[" + event(uniqueTitle("Outage")) + "]")
                .when().post("/api/ingest/events")
                .then()
                .statusCode(503)
                .body("aborted", is(true))
                .body("eventsCreated", is(0));
    }

    @Test
    void resolvesPlaceholder() {
        given()
                .when().get("/api/ingest/placeholders/volcano")
                .then()
                .statusCode(200)
                .body("url", is("/images/categories/volcano.svg"));
    }

    @Test
    void missingPlaceholderIsNotFound() {
        given()
                .when().get("/api/ingest/placeholders/genocide")
                .then()
                .statusCode(404);
    }
}

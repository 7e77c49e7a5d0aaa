package com.chronoline.timeline.api;

import com.chronoline.timeline.core.batch.BatchRunner;
import com.chronoline.timeline.core.icon.IconFallbackResolver;
import com.chronoline.timeline.core.ingest.IngestionPolicy;
import com.chronoline.timeline.core.ingest.Statistics;
import com.chronoline.timeline.loaders.csv.CsvEventLoader;
import com.chronoline.timeline.loaders.json.JsonEventLoader;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Path("/api/ingest")
@Produces(MediaType.APPLICATION_JSON)
public class IngestResource {

    private static final Logger log = Logger.getLogger(IngestResource.class);

    @Inject
    BatchRunner batchRunner;

    @Inject
    IngestionPolicy defaultPolicy;

    @Inject
    JsonEventLoader jsonLoader;

    @Inject
    CsvEventLoader csvLoader;

    @Inject
    IconFallbackResolver fallbackResolver;

    @POST
    @Path("/events")
    @Consumes(MediaType.APPLICATION_JSON)
    public IngestResponse ingestJson(InputStream body,
                                     @QueryParam("actor") String actor,
                                     @QueryParam("dryRun") @DefaultValue("false") boolean dryRun,
                                     @QueryParam("skipDuplicateTitles") Boolean skipDuplicateTitles) {
        return run(jsonLoader.load(body), actor, dryRun, skipDuplicateTitles);
    }

    @POST
    @Path("/events")
    @Consumes({"text/csv", "application/csv"})
    public IngestResponse ingestCsv(InputStream body,
                                    @QueryParam("actor") String actor,
                                    @QueryParam("dryRun") @DefaultValue("false") boolean dryRun,
                                    @QueryParam("skipDuplicateTitles") Boolean skipDuplicateTitles) {
        return run(csvLoader.load(body), actor, dryRun, skipDuplicateTitles);
    }

    @GET
    @Path("/placeholders/{category}")
    public Response placeholder(@PathParam("category") String category) {
        return fallbackResolver.resolve(category)
                .map(url -> Response.ok(Map.of("category", category, "url", url)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(Map.of("category", category, "error", "No placeholder for category"))
                        .build());
    }

    private IngestResponse run(List<JsonNode> events, String actor, boolean dryRun, Boolean skipDuplicateTitles) {
        IngestionPolicy policy = defaultPolicy.withDryRun(dryRun);
        if (skipDuplicateTitles != null) {
            policy = policy.withSkipDuplicateTitles(skipDuplicateTitles);
        }
        log.infof("Ingest request: %d events, actor=%s, dryRun=%s", events.size(), actor, dryRun);
        Statistics stats = batchRunner.ingestAll(events, actor, policy);
        return IngestResponse.from(stats.summary(policy.errorDisplayLimit()), false);
    }
}

package com.chronoline.timeline.core.batch;

import com.chronoline.timeline.core.db.DatabaseService;
import com.chronoline.timeline.core.db.StoreUnavailableException;
import com.chronoline.timeline.core.ingest.IngestOutcome;
import com.chronoline.timeline.core.ingest.IngestionContext;
import com.chronoline.timeline.core.ingest.IngestionEngine;
import com.chronoline.timeline.core.ingest.IngestionPolicy;
import com.chronoline.timeline.core.ingest.Statistics;
import com.chronoline.timeline.loaders.api.EventLoader;
import com.chronoline.timeline.loaders.api.InputContext;
import com.chronoline.timeline.loaders.api.LoadException;
import com.chronoline.timeline.loaders.registry.LoaderRegistry;
import com.chronoline.timeline.util.Coercion;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Feeds a sequence of candidate events through the {@link IngestionEngine}
 * in order. A rejected event never stops the run; an unavailable store does.
 * A store left FAILED by an earlier run is reconnected before the next one
 * starts, so an aborted run can be resumed by running again.
 */
@ApplicationScoped
public class BatchRunner {

    private static final Logger log = Logger.getLogger(BatchRunner.class);

    @Inject
    IngestionEngine engine;

    @Inject
    IngestionPolicy defaultPolicy;

    @Inject
    LoaderRegistry loaderRegistry;

    @Inject
    DatabaseService databaseService;

    public Statistics ingestAll(List<JsonNode> events, String actor) {
        return ingestAll(events, actor, defaultPolicy);
    }

    public Statistics ingestAll(List<JsonNode> events, String actor, IngestionPolicy policy) {
        IngestionContext ctx = IngestionContext.start(actor, policy);
        Set<String> seenTitles = new HashSet<>();
        int total = events.size();
        log.infof("Ingesting %d events as '%s'%s", total, ctx.actor(), policy.dryRun() ? " (dry run)" : "");
        if (!databaseService.isRunning() && !databaseService.restart()) {
            log.warnf("Event store is %s; the run will abort at the first store access",
                    databaseService.state());
        }

        for (int i = 0; i < total; i++) {
            JsonNode event = events.get(i);

            if (policy.skipDuplicateTitles()) {
                Optional<String> title = titleOf(event);
                if (title.isPresent() && !seenTitles.add(title.get())) {
                    log.debugf("[%d/%d] Duplicate title skipped: %s", i + 1, total, title.get());
                    ctx.statistics().recordDuplicate(title.get());
                    continue;
                }
            }

            IngestOutcome outcome;
            try {
                outcome = engine.ingest(event, ctx);
            } catch (StoreUnavailableException e) {
                Statistics partial = ctx.statistics().snapshot();
                log.errorf("Aborting run at event %d/%d: %s", i + 1, total, e.getMessage());
                throw new IngestionAbortedException(
                        "Store unavailable after " + i + " of " + total + " events", partial, e);
            }

            if (outcome instanceof IngestOutcome.Rejected) {
                IngestOutcome.Rejected rejected = (IngestOutcome.Rejected) outcome;
                log.debugf("[%d/%d] %s: %s", i + 1, total, rejected.kind(), rejected.reason());
            }
        }

        Statistics stats = ctx.statistics().snapshot();
        log.infof("Run complete: %d created, %d sources, %d skipped, %d fallbacks, %d duplicates",
                stats.eventsCreated(), stats.sourcesCreated(), stats.eventsSkipped(),
                stats.fallbacksApplied(), stats.duplicatesSkipped());
        return stats;
    }

    public Statistics ingestFile(Path file, String actor) {
        return ingestFile(file, actor, defaultPolicy);
    }

    /** Loads {@code file} with the loader matching its name, then runs {@link #ingestAll}. */
    public Statistics ingestFile(Path file, String actor, IngestionPolicy policy) {
        InputContext input = InputContext.of(file);
        EventLoader loader = loaderRegistry.findLoader(input)
                .orElseThrow(() -> new LoadException("No loader for " + input.filename()
                        + " (expected .json or .csv)"));

        List<JsonNode> events;
        try (InputStream in = Files.newInputStream(file)) {
            events = loader.load(in);
        } catch (IOException e) {
            throw new LoadException("Failed to read " + file, e);
        }
        log.infof("Loaded %d events from %s", events.size(), file);
        return ingestAll(events, actor, policy);
    }

    private static Optional<String> titleOf(JsonNode event) {
        if (event == null || !event.isObject()) {
            return Optional.empty();
        }
        return Coercion.nonBlankText(event.get("title"));
    }
}

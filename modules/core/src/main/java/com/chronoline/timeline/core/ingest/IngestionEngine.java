package com.chronoline.timeline.core.ingest;

import com.chronoline.timeline.core.category.CategoryRegistry;
import com.chronoline.timeline.core.dao.CategoryRecord;
import com.chronoline.timeline.core.db.DatabaseService;
import com.chronoline.timeline.core.db.StoreUnavailableException;
import com.chronoline.timeline.core.icon.IconFallbackResolver;
import com.chronoline.timeline.core.model.CandidateEvent;
import com.chronoline.timeline.core.model.CandidateSource;
import com.chronoline.timeline.core.validate.EventValidator;
import com.chronoline.timeline.core.validate.SourceValidator;
import com.chronoline.timeline.core.validate.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.JdbiException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns one candidate event into a durable event group, or a rejection.
 * <p>
 * Steps: validate, check the category against the registry, resolve the image,
 * then write event, category link, sources and location in one transaction.
 * Every per-event failure becomes an {@link IngestOutcome.Rejected}; only an
 * unreachable store escapes as {@link StoreUnavailableException}.
 */
@ApplicationScoped
public class IngestionEngine {

    private static final Logger log = Logger.getLogger(IngestionEngine.class);

    @Inject
    EventValidator validator;

    @Inject
    SourceValidator sourceValidator;

    @Inject
    CategoryRegistry categoryRegistry;

    @Inject
    IconFallbackResolver fallbackResolver;

    @Inject
    EventWriter writer;

    @Inject
    DatabaseService databaseService;

    public IngestOutcome ingest(JsonNode raw, IngestionContext ctx) {
        IngestionPolicy policy = ctx.policy();
        RunStatistics stats = ctx.statistics();

        ValidationResult validation = validator.validate(raw, policy.sourceValidation());
        if (!validation.ok()) {
            String reason = "Event validation failed: " + validation.reason();
            log.warnf("%s (%s)", reason, describe(raw));
            return reject(stats, RejectionKind.STRUCTURAL, reason);
        }
        CandidateEvent event = CandidateEvent.from(raw);

        Optional<CategoryRecord> category;
        try {
            category = categoryRegistry.find(event.category());
        } catch (JdbiException e) {
            StoreUnavailableException unavailable = databaseService.checkConnectionFailure(e);
            if (unavailable != null) {
                throw unavailable;
            }
            String reason = "Category lookup failed for '" + event.title() + "': " + rootMessage(e);
            log.errorf("Registry lookup of '%s' failed: %s", event.category(), rootMessage(e));
            return reject(stats, RejectionKind.PERSISTENCE, reason);
        }
        if (category.isEmpty() || !category.get().leaf()) {
            String reason = category.isEmpty()
                    ? "Category '" + event.category() + "' not found in registry"
                    : "Category '" + event.category() + "' is not a leaf category";
            log.warnf("Referential reject of '%s': %s", event.title(), reason);
            return reject(stats, RejectionKind.REFERENTIAL, reason);
        }

        List<CandidateSource> sources = acceptedSources(event);
        if (policy.requireSources() && sources.isEmpty()) {
            String reason = "Event '" + event.title() + "' has no valid sources";
            log.warn(reason);
            return reject(stats, RejectionKind.STRUCTURAL, reason);
        }

        Optional<String> supplied = suppliedImage(event, policy);
        Optional<String> image = supplied.isPresent() ? supplied : fallbackResolver.resolve(event.category());
        boolean fallbackUsed = supplied.isEmpty() && image.isPresent();
        if (fallbackUsed) {
            stats.recordFallback();
            log.debugf("Using placeholder %s for '%s'", image.get(), event.title());
        }

        if (policy.dryRun()) {
            stats.recordDryRun();
            log.infof("[DRY RUN] Would create event: %s", event.title());
            return IngestOutcome.dryRun(event.title());
        }

        UUID eventId = UUID.randomUUID();
        int inserted;
        try {
            inserted = writer.write(eventId, event, image.orElse(null), sources, ctx.actor());
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (JdbiException e) {
            StoreUnavailableException unavailable = databaseService.checkConnectionFailure(e);
            if (unavailable != null) {
                throw unavailable;
            }
            String reason = "Database error for '" + event.title() + "': " + rootMessage(e);
            log.errorf("Failed to insert event '%s': %s", event.title(), rootMessage(e));
            return reject(stats, RejectionKind.PERSISTENCE, reason);
        }

        stats.recordCreated(inserted);
        log.debugf("Created event %s: %s (%d sources)", eventId, event.title(), inserted);
        return IngestOutcome.created(eventId, inserted, fallbackUsed);
    }

    /** Sources that pass validation; the rest are dropped with a warning. */
    private List<CandidateSource> acceptedSources(CandidateEvent event) {
        List<CandidateSource> accepted = new ArrayList<>();
        List<JsonNode> raw = event.sources();
        for (int i = 0; i < raw.size(); i++) {
            ValidationResult result = sourceValidator.validate(raw.get(i), "sources[" + i + "]");
            if (result.ok()) {
                accepted.add(CandidateSource.from(raw.get(i)));
            } else {
                log.warnf("Skipping invalid source for '%s': %s", event.title(), result.reason());
            }
        }
        return accepted;
    }

    private static Optional<String> suppliedImage(CandidateEvent event, IngestionPolicy policy) {
        if (policy.imageTrust() == ImageTrustPolicy.PLACEHOLDER_ONLY) {
            return Optional.empty();
        }
        return event.suppliedImage();
    }

    private static IngestOutcome reject(RunStatistics stats, RejectionKind kind, String reason) {
        stats.recordRejected(kind, reason);
        return IngestOutcome.rejected(kind, reason);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static String describe(JsonNode raw) {
        if (raw != null && raw.isObject() && raw.hasNonNull("title")) {
            return "title=" + raw.get("title").asText();
        }
        return "untitled";
    }
}

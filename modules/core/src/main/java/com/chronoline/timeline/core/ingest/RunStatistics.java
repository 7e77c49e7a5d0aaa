package com.chronoline.timeline.core.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable counters for one ingestion run. Owned by a single
 * {@link IngestionContext}; not thread-safe.
 */
public class RunStatistics {

    private int eventsCreated;
    private int sourcesCreated;
    private int eventsSkipped;
    private int fallbacksApplied;
    private int structuralRejects;
    private int referentialRejects;
    private int persistenceFailures;
    private int duplicatesSkipped;
    private int dryRunAccepted;
    private final List<String> errors = new ArrayList<>();

    public void recordCreated(int sources) {
        eventsCreated++;
        sourcesCreated += sources;
    }

    public void recordRejected(RejectionKind kind, String message) {
        eventsSkipped++;
        switch (kind) {
            case STRUCTURAL -> structuralRejects++;
            case REFERENTIAL -> referentialRejects++;
            case PERSISTENCE -> persistenceFailures++;
        }
        errors.add(message);
    }

    public void recordFallback() {
        fallbacksApplied++;
    }

    public void recordDuplicate(String title) {
        duplicatesSkipped++;
        errors.add("Duplicate title skipped: " + title);
    }

    public void recordDryRun() {
        dryRunAccepted++;
    }

    public Statistics snapshot() {
        return new Statistics(eventsCreated, sourcesCreated, eventsSkipped, fallbacksApplied,
                structuralRejects, referentialRejects, persistenceFailures, duplicatesSkipped,
                dryRunAccepted, errors);
    }
}

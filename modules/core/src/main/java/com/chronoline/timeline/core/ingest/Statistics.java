package com.chronoline.timeline.core.ingest;

import java.util.List;

/**
 * Immutable snapshot of a run's counters and error messages, in the order the
 * errors occurred.
 */
public record Statistics(
        int eventsCreated,
        int sourcesCreated,
        int eventsSkipped,
        int fallbacksApplied,
        int structuralRejects,
        int referentialRejects,
        int persistenceFailures,
        int duplicatesSkipped,
        int dryRunAccepted,
        List<String> errors
) {

    public Statistics {
        errors = List.copyOf(errors);
    }

    public static Statistics empty() {
        return new Statistics(0, 0, 0, 0, 0, 0, 0, 0, 0, List.of());
    }

    /** Events that reached the engine, whatever their outcome. */
    public int eventsProcessed() {
        return eventsCreated + eventsSkipped + dryRunAccepted;
    }

    /** The first {@code limit} errors plus how many were left out. */
    public Summary summary(int limit) {
        int shown = Math.min(Math.max(limit, 0), errors.size());
        return new Summary(this, errors.subList(0, shown), errors.size() - shown);
    }

    public record Summary(Statistics statistics, List<String> errors, int moreErrors) {

        public Summary {
            errors = List.copyOf(errors);
        }
    }
}

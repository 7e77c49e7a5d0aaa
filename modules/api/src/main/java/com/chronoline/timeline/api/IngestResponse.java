package com.chronoline.timeline.api;

import com.chronoline.timeline.core.ingest.Statistics;

import java.util.List;

/**
 * JSON body returned by the ingestion endpoint: the run's counters plus
 * the first errors of the run.
 */
public record IngestResponse(
        boolean aborted,
        int eventsCreated,
        int sourcesCreated,
        int eventsSkipped,
        int fallbacksApplied,
        int structuralRejects,
        int referentialRejects,
        int persistenceFailures,
        int duplicatesSkipped,
        int dryRunAccepted,
        List<String> errors,
        int moreErrors
) {

    public static IngestResponse from(Statistics.Summary summary, boolean aborted) {
        Statistics s = summary.statistics();
        return new IngestResponse(aborted,
                s.eventsCreated(), s.sourcesCreated(), s.eventsSkipped(), s.fallbacksApplied(),
                s.structuralRejects(), s.referentialRejects(), s.persistenceFailures(),
                s.duplicatesSkipped(), s.dryRunAccepted(),
                summary.errors(), summary.moreErrors());
    }
}

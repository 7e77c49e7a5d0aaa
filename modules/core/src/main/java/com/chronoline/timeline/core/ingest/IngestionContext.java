package com.chronoline.timeline.core.ingest;

import java.util.Objects;

/**
 * Everything one run carries between events: who is ingesting, under which
 * policy, and the counters so far. Created fresh per run.
 */
public record IngestionContext(String actor, IngestionPolicy policy, RunStatistics statistics) {

    public static final String DEFAULT_ACTOR = "system";

    public IngestionContext {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(statistics, "statistics");
        if (actor == null || actor.isBlank()) {
            actor = DEFAULT_ACTOR;
        }
    }

    public static IngestionContext start(String actor, IngestionPolicy policy) {
        return new IngestionContext(actor, policy, new RunStatistics());
    }
}

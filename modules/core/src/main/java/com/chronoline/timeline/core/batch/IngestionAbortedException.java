package com.chronoline.timeline.core.batch;

import com.chronoline.timeline.core.ingest.Statistics;

/**
 * A run stopped early because the store became unavailable. Carries the
 * counters accumulated before the abort; events counted as created stay
 * committed.
 */
public class IngestionAbortedException extends RuntimeException {

    private final Statistics partial;

    public IngestionAbortedException(String message, Statistics partial, Throwable cause) {
        super(message, cause);
        this.partial = partial;
    }

    public Statistics partial() {
        return partial;
    }
}

package com.chronoline.timeline.core.db;

/**
 * Thrown when the event store cannot be reached, either because
 * {@link DatabaseService} is not RUNNING or because a connection-level
 * failure was observed mid-operation. Callers abort the current run.
 */
public class StoreUnavailableException extends IllegalStateException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.chronoline.timeline.loaders.api;

/**
 * Producer input that cannot be read as a sequence of candidate events.
 */
public class LoadException extends RuntimeException {

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public LoadException(String message) {
        super(message);
    }
}

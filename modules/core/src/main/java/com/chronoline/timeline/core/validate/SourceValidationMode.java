package com.chronoline.timeline.core.validate;

/**
 * What an invalid entry in an event's {@code sources} list does to the event.
 */
public enum SourceValidationMode {
    /** The first invalid source rejects the whole event before any write. */
    REJECT_EVENT,
    /** Invalid sources are dropped with a warning; the event is still stored. */
    SKIP_SOURCE
}

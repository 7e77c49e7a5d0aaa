package com.chronoline.timeline.core.ingest;

public enum RejectionKind {
    /** Failed structural or domain validation; nothing was written. */
    STRUCTURAL,
    /** Referenced a category the registry does not know. */
    REFERENTIAL,
    /** The store refused the write; the whole group was rolled back. */
    PERSISTENCE
}

package com.chronoline.timeline.core.validate;

/**
 * Category of a failed check, independent of the human-readable reason.
 */
public enum Violation {
    NOT_AN_OBJECT,
    MISSING_FIELD,
    WRONG_TYPE,
    NOT_NUMERIC,
    OUT_OF_RANGE,
    UNKNOWN_ENUM,
    INVALID_SOURCE
}

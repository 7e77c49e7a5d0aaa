package com.chronoline.timeline.types;

import java.util.Optional;

/**
 * Granularity at which an event's instant is known. Closed set: unknown labels
 * are rejected by {@link #fromLabel(String)}, never mapped to a nearby level.
 */
public enum PrecisionLevel {
    NANOSECOND("nanosecond"),
    MICROSECOND("microsecond"),
    MILLISECOND("millisecond"),
    SECOND("second"),
    MINUTE("minute"),
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year"),
    DECADE("decade"),
    CENTURY("century"),
    THOUSAND_YEARS("thousand_years"),
    MILLION_YEARS("million_years"),
    BILLION_YEARS("billion_years");

    private final String label;

    PrecisionLevel(String label) {
        this.label = label;
    }

    /** Wire and column value, e.g. {@code thousand_years}. */
    public String label() {
        return label;
    }

    public static Optional<PrecisionLevel> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (PrecisionLevel p : values()) {
            if (p.label.equals(label)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public static PrecisionLevel requireLabel(String label) {
        return fromLabel(label).orElseThrow(() ->
                new IllegalArgumentException("Unknown PrecisionLevel label: " + label));
    }
}

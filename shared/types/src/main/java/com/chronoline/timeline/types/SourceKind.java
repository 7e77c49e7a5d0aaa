package com.chronoline.timeline.types;

import java.util.Optional;

public enum SourceKind {
    SCIENTIFIC_PAPER("scientific_paper"),
    BOOK("book"),
    ARTICLE("article"),
    DATABASE("database"),
    EXPERT_CONSENSUS("expert_consensus"),
    WIKIPEDIA("wikipedia"),
    WIKIDATA("wikidata"),
    OTHER("other");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<SourceKind> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (SourceKind k : values()) {
            if (k.label.equals(label)) return Optional.of(k);
        }
        return Optional.empty();
    }

    public static SourceKind requireLabel(String label) {
        return fromLabel(label).orElseThrow(() ->
                new IllegalArgumentException("Unknown SourceKind label: " + label));
    }
}

package com.chronoline.timeline.core.model;

import com.chronoline.timeline.types.SourceKind;
import com.chronoline.timeline.util.Coercion;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A validated citation, with persistence defaults applied.
 */
public record CandidateSource(
        String url,
        String title,
        SourceKind kind,
        String citation,
        int credibility
) {

    public static final int DEFAULT_CREDIBILITY = 50;

    /** Converts a source that already passed validation. */
    public static CandidateSource from(JsonNode source) {
        SourceKind kind = Coercion.nonBlankText(source.get("source_type"))
                .flatMap(SourceKind::fromLabel)
                .orElse(SourceKind.OTHER);
        int credibility = Coercion.toBoundedInt(source.get("credibility_score"), 0, 100)
                .map(Coercion.RangeCheck::intValue)
                .orElse(DEFAULT_CREDIBILITY);
        return new CandidateSource(
                Coercion.nonBlankText(source.get("url")).orElse(null),
                Coercion.nonBlankText(source.get("title")).orElse(null),
                kind,
                Coercion.nonBlankText(source.get("citation")).orElse(null),
                credibility);
    }
}

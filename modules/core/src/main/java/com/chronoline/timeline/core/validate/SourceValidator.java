package com.chronoline.timeline.core.validate;

import com.chronoline.timeline.types.SourceKind;
import com.chronoline.timeline.util.Coercion;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Singleton;

import java.util.Optional;

/**
 * Checks a single candidate source. The {@code context} (e.g. {@code sources[2]})
 * prefixes every reason so batch reports point at the offending entry.
 */
@Singleton
public class SourceValidator {

    public ValidationResult validate(JsonNode source, String context) {
        if (source == null || !source.isObject()) {
            return ValidationResult.fail(Violation.NOT_AN_OBJECT, context + ": must be an object");
        }

        if (Coercion.nonBlankText(source.get("url")).isEmpty()
                && Coercion.nonBlankText(source.get("title")).isEmpty()) {
            return ValidationResult.fail(Violation.MISSING_FIELD, context + ": must have 'url' or 'title'");
        }

        JsonNode kind = source.get("source_type");
        if (!Coercion.isAbsent(kind)) {
            if (!kind.isTextual() || SourceKind.fromLabel(kind.textValue()).isEmpty()) {
                return ValidationResult.fail(Violation.UNKNOWN_ENUM,
                        context + ": invalid source_type: " + kind.asText());
            }
        }

        JsonNode credibility = source.get("credibility_score");
        if (!Coercion.isAbsent(credibility)) {
            Optional<Coercion.RangeCheck> check = Coercion.toBoundedInt(credibility, 0, 100);
            if (check.isEmpty()) {
                return ValidationResult.fail(Violation.NOT_NUMERIC,
                        context + ": credibility_score must be numeric");
            }
            if (!check.get().inRange()) {
                return ValidationResult.fail(Violation.OUT_OF_RANGE,
                        context + ": credibility_score must be between 0 and 100");
            }
        }

        return ValidationResult.valid();
    }
}

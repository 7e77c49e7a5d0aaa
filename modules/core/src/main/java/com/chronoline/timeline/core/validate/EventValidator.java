package com.chronoline.timeline.core.validate;

import com.chronoline.timeline.types.PrecisionLevel;
import com.chronoline.timeline.util.Coercion;
import com.chronoline.timeline.util.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Structural and domain checks for a candidate event, run in a fixed order and
 * stopping at the first failure:
 * <ol>
 *   <li>the event is a JSON object</li>
 *   <li>required fields are present, {@code category} is text</li>
 *   <li>latitude and longitude are numeric</li>
 *   <li>latitude and longitude are within their ranges</li>
 *   <li>{@code precision_level} is a known label</li>
 *   <li>{@code unix_seconds} (and {@code unix_nanos}) are whole numbers</li>
 *   <li>{@code importance_score} is within 0..100</li>
 *   <li>{@code sources} is a list of valid sources</li>
 * </ol>
 * Category existence is a referential concern and is left to the caller.
 * The validator has no state and never touches the store.
 */
@Singleton
public class EventValidator {

    static final List<String> REQUIRED_FIELDS =
            List.of("title", "unix_seconds", "precision_level", "latitude", "longitude", "category");

    static final int MAX_NANOS = 999_999_999;

    private final SourceValidator sourceValidator;

    @Inject
    public EventValidator(SourceValidator sourceValidator) {
        this.sourceValidator = sourceValidator;
    }

    public ValidationResult validate(JsonNode event) {
        return validate(event, SourceValidationMode.REJECT_EVENT);
    }

    public ValidationResult validate(JsonNode event, SourceValidationMode sourceMode) {
        if (event == null || !event.isObject()) {
            return ValidationResult.fail(Violation.NOT_AN_OBJECT, "event must be an object");
        }

        for (String field : REQUIRED_FIELDS) {
            if (isMissing(event, field)) {
                return ValidationResult.fail(Violation.MISSING_FIELD, "Missing required field: " + field);
            }
        }
        if (!event.get("title").isTextual()) {
            return ValidationResult.fail(Violation.WRONG_TYPE, "title must be a string");
        }
        if (!event.get("category").isTextual()) {
            return ValidationResult.fail(Violation.WRONG_TYPE, "category must be a string");
        }

        OptionalDouble latitude = Coercion.toDouble(event.get("latitude"));
        if (latitude.isEmpty()) {
            return ValidationResult.fail(Violation.NOT_NUMERIC, "latitude must be numeric");
        }
        OptionalDouble longitude = Coercion.toDouble(event.get("longitude"));
        if (longitude.isEmpty()) {
            return ValidationResult.fail(Violation.NOT_NUMERIC, "longitude must be numeric");
        }
        if (!GeoPoint.isValidLatitude(latitude.getAsDouble())) {
            return ValidationResult.fail(Violation.OUT_OF_RANGE, "latitude must be between -90 and 90");
        }
        if (!GeoPoint.isValidLongitude(longitude.getAsDouble())) {
            return ValidationResult.fail(Violation.OUT_OF_RANGE, "longitude must be between -180 and 180");
        }

        JsonNode precision = event.get("precision_level");
        if (!precision.isTextual() || PrecisionLevel.fromLabel(precision.textValue()).isEmpty()) {
            return ValidationResult.fail(Violation.UNKNOWN_ENUM, "Invalid precision_level: " + precision.asText());
        }

        if (Coercion.toLong(event.get("unix_seconds")).isEmpty()) {
            return ValidationResult.fail(Violation.NOT_NUMERIC, "unix_seconds must be an integer");
        }
        ValidationResult nanos = checkBounded(event.get("unix_nanos"), "unix_nanos", 0, MAX_NANOS);
        if (!nanos.ok()) {
            return nanos;
        }

        ValidationResult importance = checkBounded(event.get("importance_score"), "importance_score", 0, 100);
        if (!importance.ok()) {
            return importance;
        }

        return validateSources(event.get("sources"), sourceMode);
    }

    private ValidationResult validateSources(JsonNode sources, SourceValidationMode sourceMode) {
        if (Coercion.isAbsent(sources)) {
            return ValidationResult.valid();
        }
        if (!sources.isArray()) {
            return ValidationResult.fail(Violation.WRONG_TYPE, "sources must be a list");
        }
        // SKIP_SOURCE defers per-entry checks to insert time
        if (sourceMode == SourceValidationMode.SKIP_SOURCE) {
            return ValidationResult.valid();
        }
        for (int i = 0; i < sources.size(); i++) {
            ValidationResult result = sourceValidator.validate(sources.get(i), "sources[" + i + "]");
            if (!result.ok()) {
                return ValidationResult.fail(Violation.INVALID_SOURCE, result.reason());
            }
        }
        return ValidationResult.valid();
    }

    private static ValidationResult checkBounded(JsonNode node, String field, int min, int max) {
        if (Coercion.isAbsent(node)) {
            return ValidationResult.valid();
        }
        Optional<Coercion.RangeCheck> check = Coercion.toBoundedInt(node, min, max);
        if (check.isEmpty()) {
            return ValidationResult.fail(Violation.NOT_NUMERIC, field + " must be numeric");
        }
        if (!check.get().inRange()) {
            return ValidationResult.fail(Violation.OUT_OF_RANGE,
                    field + " must be between " + min + " and " + max);
        }
        return ValidationResult.valid();
    }

    private static boolean isMissing(JsonNode event, String field) {
        JsonNode value = event.get(field);
        if (Coercion.isAbsent(value)) {
            return true;
        }
        return value.isTextual() && value.textValue().isBlank();
    }
}

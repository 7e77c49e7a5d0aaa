package com.chronoline.timeline.core.validate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class EventValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EventValidator validator = new EventValidator(new SourceValidator());

    private static ObjectNode bastille() {
        ObjectNode event = MAPPER.createObjectNode();
        event.put("title", "Storming of the Bastille");
        event.put("unix_seconds", -5694969600L);
        event.put("precision_level", "day");
        event.put("latitude", 48.8532);
        event.put("longitude", 2.3692);
        event.put("category", "revolution");
        return event;
    }

    @Test
    void shouldAcceptMinimalEvent() {
        assertThat(validator.validate(bastille()).ok()).isTrue();
    }

    @Test
    void shouldRejectNonObject() {
        ValidationResult result = validator.validate(MAPPER.createArrayNode());

        assertThat(result.ok()).isFalse();
        assertThat(result.violation()).isEqualTo(Violation.NOT_AN_OBJECT);
    }

    @Test
    void shouldRejectNull() {
        assertThat(validator.validate(null).violation()).isEqualTo(Violation.NOT_AN_OBJECT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"title", "unix_seconds", "precision_level", "latitude", "longitude", "category"})
    void shouldNameEachMissingRequiredField(String field) {
        ObjectNode event = bastille();
        event.remove(field);

        ValidationResult result = validator.validate(event);

        assertThat(result.violation()).isEqualTo(Violation.MISSING_FIELD);
        assertThat(result.reason()).contains(field);
    }

    @Test
    void shouldTreatBlankTitleAndNullAsMissing() {
        ObjectNode blank = bastille().put("title", "   ");
        ObjectNode nullLatitude = bastille().putNull("latitude");

        assertThat(validator.validate(blank).violation()).isEqualTo(Violation.MISSING_FIELD);
        assertThat(validator.validate(nullLatitude).violation()).isEqualTo(Violation.MISSING_FIELD);
    }

    @Test
    void shouldRequireTextualCategory() {
        ObjectNode event = bastille().put("category", 7);

        ValidationResult result = validator.validate(event);

        assertThat(result.violation()).isEqualTo(Violation.WRONG_TYPE);
        assertThat(result.reason()).contains("category");
    }

    @Test
    void shouldDistinguishNonNumericFromOutOfRange() {
        ValidationResult nonNumeric = validator.validate(bastille().put("latitude", "north"));
        ValidationResult outOfRange = validator.validate(bastille().put("latitude", 91));

        assertThat(nonNumeric.violation()).isEqualTo(Violation.NOT_NUMERIC);
        assertThat(outOfRange.violation()).isEqualTo(Violation.OUT_OF_RANGE);
        assertThat(nonNumeric.reason()).isNotEqualTo(outOfRange.reason());
        assertThat(outOfRange.reason()).contains("latitude");
    }

    @Test
    void shouldAcceptCoordinateBounds() {
        ObjectNode corner = bastille().put("latitude", -90).put("longitude", 180);

        assertThat(validator.validate(corner).ok()).isTrue();
    }

    @Test
    void shouldRejectLongitudeOutOfRange() {
        ValidationResult result = validator.validate(bastille().put("longitude", -180.5));

        assertThat(result.violation()).isEqualTo(Violation.OUT_OF_RANGE);
        assertThat(result.reason()).contains("longitude");
    }

    @Test
    void shouldAcceptNumericStrings() {
        ObjectNode event = bastille()
                .put("latitude", "48.8532")
                .put("longitude", " 2.3692 ")
                .put("unix_seconds", "-5694969600");

        assertThat(validator.validate(event).ok()).isTrue();
    }

    @Test
    void shouldCheckCoercionBeforeRange() {
        ObjectNode event = bastille().put("latitude", 200).put("longitude", "east");

        assertThat(validator.validate(event).violation()).isEqualTo(Violation.NOT_NUMERIC);
    }

    @Test
    void shouldRejectUnknownPrecision() {
        ValidationResult result = validator.validate(bastille().put("precision_level", "fortnight"));

        assertThat(result.violation()).isEqualTo(Violation.UNKNOWN_ENUM);
        assertThat(result.reason()).contains("fortnight");
    }

    @Test
    void shouldRejectFractionalTimestampText() {
        ValidationResult result = validator.validate(bastille().put("unix_seconds", "12.5"));

        assertThat(result.violation()).isEqualTo(Violation.NOT_NUMERIC);
        assertThat(result.reason()).contains("unix_seconds");
    }

    @Test
    void shouldAcceptDeepTimeTimestamps() {
        ObjectNode bigBang = bastille()
                .put("unix_seconds", -435494880000000000L)
                .put("precision_level", "billion_years");

        assertThat(validator.validate(bigBang).ok()).isTrue();
    }

    @Test
    void shouldBoundNanos() {
        assertThat(validator.validate(bastille().put("unix_nanos", 999_999_999)).ok()).isTrue();
        assertThat(validator.validate(bastille().put("unix_nanos", 1_000_000_000)).violation())
                .isEqualTo(Violation.OUT_OF_RANGE);
        assertThat(validator.validate(bastille().put("unix_nanos", -1)).violation())
                .isEqualTo(Violation.OUT_OF_RANGE);
    }

    @Test
    void shouldBoundImportance() {
        assertThat(validator.validate(bastille().put("importance_score", 100)).ok()).isTrue();
        assertThat(validator.validate(bastille().put("importance_score", 101)).violation())
                .isEqualTo(Violation.OUT_OF_RANGE);
        assertThat(validator.validate(bastille().put("importance_score", "high")).violation())
                .isEqualTo(Violation.NOT_NUMERIC);
    }

    @Test
    void shouldRequireSourcesToBeAList() {
        ObjectNode event = bastille();
        event.putObject("sources").put("url", "https://example.org");

        ValidationResult result = validator.validate(event);

        assertThat(result.violation()).isEqualTo(Violation.WRONG_TYPE);
        assertThat(result.reason()).contains("sources");
    }

    @Test
    void shouldRejectEventOnFirstInvalidSourceNamingItsIndex() {
        ObjectNode event = bastille();
        ArrayNode sources = event.putArray("sources");
        sources.addObject().put("url", "https://www.wikidata.org/wiki/Q80330");
        sources.addObject().put("title", "Encyclopaedia").put("source_type", "blog");

        ValidationResult result = validator.validate(event);

        assertThat(result.violation()).isEqualTo(Violation.INVALID_SOURCE);
        assertThat(result.reason()).contains("sources[1]").contains("blog");
    }

    @Test
    void shouldDeferSourceChecksWhenSkippingSources() {
        ObjectNode event = bastille();
        event.putArray("sources").addObject().put("source_type", "blog");

        assertThat(validator.validate(event, SourceValidationMode.SKIP_SOURCE).ok()).isTrue();
        assertThat(validator.validate(event, SourceValidationMode.REJECT_EVENT).ok()).isFalse();
    }

    @Test
    void shouldNotCheckCategoryExistence() {
        assertThat(validator.validate(bastille().put("category", "no_such_category")).ok()).isTrue();
    }
}

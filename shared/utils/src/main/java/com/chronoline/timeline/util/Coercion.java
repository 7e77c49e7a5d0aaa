package com.chronoline.timeline.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Coerces loosely typed producer values into numbers and text.
 *
 * <p>Numbers may arrive as JSON numbers or as numeric strings (CSV input is all
 * strings). Booleans, containers and non-finite values never coerce.
 * A missing node and JSON {@code null} are both treated as absent.
 */
public final class Coercion {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Coercion() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Text of a scalar node, trimmed; empty when absent or blank. */
    public static Optional<String> nonBlankText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return Optional.empty();
        }
        String text = node.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /** Text of a scalar node exactly as supplied; empty when absent or blank. */
    public static Optional<String> verbatimText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return Optional.empty();
        }
        String text = node.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public static OptionalDouble toDouble(JsonNode node) {
        if (isAbsent(node) || node.isBoolean() || node.isContainerNode()) {
            return OptionalDouble.empty();
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * Integer coercion. Fractional JSON numbers truncate toward zero; numeric
     * strings must be whole numbers. Values outside the signed 64-bit range
     * do not coerce.
     */
    public static OptionalLong toLong(JsonNode node) {
        if (isAbsent(node) || node.isBoolean() || node.isContainerNode()) {
            return OptionalLong.empty();
        }
        BigInteger value;
        if (node.isIntegralNumber()) {
            value = node.bigIntegerValue();
        } else if (node.isNumber()) {
            if (!Double.isFinite(node.doubleValue())) {
                return OptionalLong.empty();
            }
            value = node.decimalValue().toBigInteger();
        } else if (node.isTextual()) {
            try {
                value = new BigInteger(node.textValue().trim());
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        } else {
            return OptionalLong.empty();
        }
        if (value.compareTo(LONG_MIN) < 0 || value.compareTo(LONG_MAX) > 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value.longValueExact());
    }

    /** Integer coercion restricted to {@code [min, max]}; empty if not numeric. */
    public static Optional<RangeCheck> toBoundedInt(JsonNode node, int min, int max) {
        OptionalLong value = toLong(node);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        long v = value.getAsLong();
        return Optional.of(new RangeCheck(v, v >= min && v <= max));
    }

    /** Whole-number coercion outcome: the value and whether it fell in range. */
    public record RangeCheck(long value, boolean inRange) {

        /** Only meaningful when {@link #inRange()} holds for an int-sized range. */
        public int intValue() {
            return Math.toIntExact(value);
        }
    }
}

package com.centinel.core.normalizer;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalLong;

/**
 * Integer coercion for source values. Integral numbers pass through, floating
 * numbers are truncated, and numeric strings are accepted after removing
 * whitespace and {@code ,} thousands separators (anything after a {@code .} is
 * dropped). Values outside the {@code long} range and everything else are
 * not coercible.
 */
public final class NumericCoercion {

    private NumericCoercion() {
    }

    public static OptionalLong coerce(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OptionalLong.empty();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? OptionalLong.of(node.longValue()) : OptionalLong.empty();
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(node.decimalValue().setScale(0, RoundingMode.DOWN).longValueExact());
            } catch (ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
        if (node.isTextual()) {
            return coerce(node.textValue());
        }
        return OptionalLong.empty();
    }

    public static OptionalLong coerce(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String cleaned = text.strip().replace(",", "").replace(" ", "").replace(" ", "");
        int dot = cleaned.indexOf('.');
        if (dot >= 0) {
            String fraction = cleaned.substring(dot + 1);
            if (!fraction.chars().allMatch(Character::isDigit)) {
                return OptionalLong.empty();
            }
            cleaned = cleaned.substring(0, dot);
        }
        if (cleaned.isEmpty() || "-".equals(cleaned) || "+".equals(cleaned)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(new BigDecimal(cleaned).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }
}

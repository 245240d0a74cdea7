package com.centinel.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Brings free-form metadata values into one canonical Java shape so that
 * snapshots compare equal regardless of how they were built or parsed:
 * integral numbers become {@code Long} (their decimal text when they do not
 * fit one), other numbers {@code Double},
 * maps become sorted unmodifiable maps and lists unmodifiable lists.
 */
public final class MetadataValues {

    // 2^63, first double magnitude outside the long range
    private static final double LONG_RANGE = 0x1p63;

    private MetadataValues() {
    }

    public static SortedMap<String, Object> normalizeMap(Map<String, ?> source) {
        TreeMap<String, Object> result = new TreeMap<>();
        if (source == null) {
            return Collections.unmodifiableSortedMap(result);
        }
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "Metadata key cannot be null");
            Object value = normalize(entry.getValue());
            if (value != null) {
                result.put(entry.getKey(), value);
            }
        }
        return Collections.unmodifiableSortedMap(result);
    }

    public static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence sequence) {
            return sequence.toString();
        }
        if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? (Object) big.longValue() : big.toString();
        }
        if (value instanceof BigDecimal decimal) {
            if (decimal.stripTrailingZeros().scale() > 0) {
                return decimal.doubleValue();
            }
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                return decimal.toPlainString();
            }
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < LONG_RANGE) {
                return (long) d;
            }
            return d;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return normalizeMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                Object normalized = normalize(item);
                if (normalized != null) {
                    copy.add(normalized);
                }
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value.toString();
    }
}

package com.furnaceintel.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One decoded row of the upstream payload: variable name to raw value, in payload order.
 *
 * Values are restricted to what the payload literal can carry: String, Long, Double,
 * Boolean or null. The Timelogged entry is the record's timestamp and is exposed
 * separately through {@link #timestampText()}.
 */
public final class RawRecord {

    public static final String TIMESTAMP_FIELD = "Timelogged";

    private final Map<String, Object> values;

    private RawRecord(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static RawRecord of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> copy.put(name, requireScalar(name, value)));
        return new RawRecord(copy);
    }

    /** Raw timestamp string, if the record carries one. */
    public Optional<String> timestampText() {
        Object ts = values.get(TIMESTAMP_FIELD);
        if (ts == null) return Optional.empty();
        String text = ts.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<Map.Entry<String, Object>> entries() {
        return values.entrySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * Copy of this record holding only the allowed variable names. The timestamp always survives.
     */
    public RawRecord restrictTo(Set<String> allowed) {
        Map<String, Object> kept = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (allowed.contains(name) || TIMESTAMP_FIELD.equals(name)) {
                kept.put(name, value);
            }
        });
        return new RawRecord(kept);
    }

    private static Object requireScalar(String name, Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Long
                || value instanceof Double
                || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return n instanceof Float ? (Object) n.doubleValue() : (Object) n.longValue();
        }
        throw new IllegalArgumentException("Unsupported value type for " + name + ": " + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RawRecord other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RawRecord" + values;
    }
}

package com.furnaceintel.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A single time-series point: one measurement, its numeric fields and a second-resolution
 * UTC timestamp. Serializes to one line-protocol line.
 */
public record Point(String measurement, Map<String, Double> fields, long epochSeconds) {

    public Point {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Point for " + measurement + " has no fields");
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /** {@code measurement f1=v1,f2=v2 <epochSeconds>} */
    public String toLineProtocol() {
        String fieldSet = fields.entrySet().stream()
                .map(e -> escapeKey(e.getKey()) + "=" + e.getValue())
                .collect(Collectors.joining(","));
        return escapeMeasurement(measurement) + " " + fieldSet + " " + epochSeconds;
    }

    private static String escapeMeasurement(String s) {
        return s.replace(",", "\\,").replace(" ", "\\ ");
    }

    private static String escapeKey(String s) {
        return s.replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
    }
}

package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.model.FieldIdentity;
import com.furnaceintel.pipeline.model.Point;
import com.furnaceintel.pipeline.model.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Groups one record's classified values into one point per measurement.
 *
 * Measurements appear in the order their first field was seen in the record, and fields
 * keep record order, so the same record always serializes to the same lines.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PointBuilder {

    private final FieldClassifier classifier;

    public List<Point> build(RawRecord record, Instant timestamp) {
        Map<String, Map<String, Double>> byMeasurement = new LinkedHashMap<>();
        int unknown = 0;
        int reserved = 0;
        int absent = 0;

        for (Map.Entry<String, Object> entry : record.entries()) {
            Optional<FieldIdentity> identity = classifier.classify(entry.getKey());
            if (identity.isEmpty()) {
                unknown++;
                continue;
            }
            String field = identity.get().field();
            // Reserved string fields are classified but not emitted yet.
            if (classifier.isForcedString(field)) {
                reserved++;
                continue;
            }
            OptionalDouble value = FieldClassifier.toNumeric(entry.getValue());
            if (value.isEmpty()) {
                absent++;
                continue;
            }
            byMeasurement
                    .computeIfAbsent(identity.get().measurement(), m -> new LinkedHashMap<>())
                    .put(field, value.getAsDouble());
        }

        long epochSeconds = timestamp.getEpochSecond();
        List<Point> points = new ArrayList<>(byMeasurement.size());
        byMeasurement.forEach((measurement, fields) -> points.add(new Point(measurement, fields, epochSeconds)));

        log.debug("Built {} points at {} from {} variables ({} unknown, {} reserved, {} without value)",
                points.size(), timestamp, record.size(), unknown, reserved, absent);
        return points;
    }
}

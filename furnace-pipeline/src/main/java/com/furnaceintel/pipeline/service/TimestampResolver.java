package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Normalizes the plant-local Timelogged string (e.g. "05/29/2025 12:00:00 AM") to a UTC instant.
 */
@Component
@Slf4j
public class TimestampResolver {

    private final DateTimeFormatter formatter;
    private final ZoneId zone;

    public TimestampResolver(FurnacePipelineProperties properties) {
        this.formatter = DateTimeFormatter.ofPattern(properties.getApi().getTimestampFormat(), Locale.US);
        this.zone = ZoneId.of(properties.getTimezone());
    }

    public Optional<Instant> resolve(RawRecord record) {
        Optional<String> text = record.timestampText();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(text.get(), formatter).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse {}: '{}' - {}", RawRecord.TIMESTAMP_FIELD, text.get(), e.getMessage());
            return Optional.empty();
        }
    }
}

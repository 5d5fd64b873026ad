package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.influxdb.client.InfluxDBClient;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Looks a point up in InfluxDB by measurement, tags and exact second.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InfluxExistenceChecker implements ExistenceChecker {

    private final InfluxDBClient influxDBClient;
    private final FurnacePipelineProperties properties;

    @Override
    public boolean exists(String measurement, Map<String, String> tags, Instant timestamp) {
        String flux = buildQuery(properties.getInflux().getBucket(), measurement, tags, timestamp);
        try {
            List<FluxTable> tables = influxDBClient.getQueryApi().query(flux, properties.getInflux().getOrg());
            boolean found = tables.stream().anyMatch(t -> !t.getRecords().isEmpty());
            log.trace("Point {}@{} exists: {}", measurement, timestamp, found);
            return found;
        } catch (InfluxException e) {
            throw new StoreException("InfluxDB existence check for " + measurement + " failed: " + e.getMessage(), e);
        }
    }

    static String buildQuery(String bucket, String measurement, Map<String, String> tags, Instant timestamp) {
        StringBuilder flux = new StringBuilder()
                .append("from(bucket: \"").append(quote(bucket)).append("\")\n")
                .append("  |> range(start: ").append(timestamp)
                .append(", stop: ").append(timestamp.plusSeconds(1)).append(")\n")
                .append("  |> filter(fn: (r) => r._measurement == \"").append(quote(measurement)).append("\")\n");
        tags.forEach((key, value) -> flux
                .append("  |> filter(fn: (r) => r[\"").append(quote(key)).append("\"] == \"")
                .append(quote(value)).append("\")\n"));
        return flux.append("  |> limit(n: 1)").toString();
    }

    private static String quote(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

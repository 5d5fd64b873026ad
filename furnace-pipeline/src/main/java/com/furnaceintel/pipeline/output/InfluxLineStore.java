package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.domain.WritePrecision;
import com.influxdb.exceptions.InfluxException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class InfluxLineStore implements TimeSeriesStore {

    private final InfluxDBClient influxDBClient;
    private final FurnacePipelineProperties properties;

    @Override
    public void write(List<String> lines) {
        FurnacePipelineProperties.Influx influx = properties.getInflux();
        try {
            influxDBClient.getWriteApiBlocking()
                    .writeRecords(influx.getBucket(), influx.getOrg(), WritePrecision.S, lines);
            log.debug("Wrote {} lines to bucket {}", lines.size(), influx.getBucket());
        } catch (InfluxException e) {
            throw new StoreException("InfluxDB write of " + lines.size() + " lines failed: " + e.getMessage(), e);
        }
    }
}

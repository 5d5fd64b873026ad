package com.furnaceintel.pipeline.config;

import com.furnaceintel.pipeline.service.FieldClassifier;
import com.furnaceintel.pipeline.service.MappingTablesLoader;
import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

@Configuration
@Slf4j
public class PipelineBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, FurnacePipelineProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getTimeout())
                .setReadTimeout(properties.getApi().getTimeout())
                .build();
    }

    @Bean
    public FieldClassifier fieldClassifier(MappingTablesLoader loader, FurnacePipelineProperties properties) {
        return new FieldClassifier(loader.load(), properties.getMappings().getStringFields());
    }

    @Bean
    public InfluxDBClient influxDBClient(FurnacePipelineProperties properties) {
        FurnacePipelineProperties.Influx influx = properties.getInflux();
        log.info("InfluxDB client for {}, org={}, bucket={}", influx.getUrl(), influx.getOrg(), influx.getBucket());
        char[] token = influx.getToken() == null ? new char[0] : influx.getToken().toCharArray();
        return InfluxDBClientFactory.create(influx.getUrl(), token, influx.getOrg(), influx.getBucket());
    }

    /** Embedded SQLite file backing the run ledger. */
    @Bean
    public DataSource ledgerDataSource(FurnacePipelineProperties properties) {
        Path dbPath = Paths.get(properties.getLedger().getDbPath()).toAbsolutePath();
        try {
            if (dbPath.getParent() != null) {
                Files.createDirectories(dbPath.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create ledger directory for " + dbPath, e);
        }
        log.info("Resolved absolute DB path: {}", dbPath);

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource ledgerDataSource) {
        return new JdbcTemplate(ledgerDataSource);
    }
}

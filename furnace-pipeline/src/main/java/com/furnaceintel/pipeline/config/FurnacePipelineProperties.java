package com.furnaceintel.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "furnace")
@Data
public class FurnacePipelineProperties {

    /** Plant-local zone the upstream API reports Timelogged values in. */
    private String timezone = "UTC";

    private Api api = new Api();
    private Influx influx = new Influx();
    private Output output = new Output();
    private Ledger ledger = new Ledger();
    private Live live = new Live();
    private Mappings mappings = new Mappings();
    private Run run = new Run();

    @Data
    public static class Api {
        private String liveUrl;
        private String liveUser;
        private String livePassword;
        private String dailyUrl;
        private String dailyUser;
        private String dailyPassword;
        /** Date format the daily endpoint and the ledger use, e.g. 05-29-2025. */
        private String dateFormat = "MM-dd-yyyy";
        private String timestampFormat = "MM/dd/yyyy hh:mm:ss a";
        private Duration timeout = Duration.ofSeconds(60);
        /** Pause between (date, range) units in a backfill sweep. */
        private Duration unitDelay = Duration.ZERO;
    }

    @Data
    public static class Influx {
        private String url = "http://localhost:8086";
        private String token;
        private String org;
        private String bucket;
        private int batchSize = 5000;
        private int maxRetries = 5;
        private Duration retryInterval = Duration.ofSeconds(5);
        private double exponentialBase = 2;
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        /** Pause between successful batch writes, for the store's ingestion rate limit. */
        private Duration writeDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Output {
        private String dir = "output";
        private String logDir = "logs";
        private String dateFormatFilename = "yyyyMMdd";
        private String timeFormatFilename = "HHmmss";
        private boolean csvExport = false;
    }

    @Data
    public static class Ledger {
        private String dbPath = "db/run_metadata.db";
    }

    @Data
    public static class Live {
        private boolean enabled = false;
        /** Wall-clock period one live poll is stretched to. */
        private Duration cadence = Duration.ofSeconds(60);
        private long pollGapMs = 1000;
    }

    @Data
    public static class Mappings {
        private String location = "classpath:field-mappings.yml";
        /** Field identities that must never be written numerically. */
        private Set<String> stringFields = new LinkedHashSet<>(Set.of("hot_blast_temp_spare"));
    }

    /** Defaults for the per-run flags; the command runner and REST triggers may override them. */
    @Data
    public static class Run {
        private boolean dbWrite = false;
        private boolean override = true;
        private boolean retainFile = false;
        private boolean logRun = false;
    }
}

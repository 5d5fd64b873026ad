package com.furnaceintel.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.ledger.RunLedger;
import com.furnaceintel.pipeline.model.Point;
import com.furnaceintel.pipeline.model.RawRecord;
import com.furnaceintel.pipeline.model.RunMode;
import com.furnaceintel.pipeline.model.RunOptions;
import com.furnaceintel.pipeline.model.RunRecord;
import com.furnaceintel.pipeline.output.CsvTableExporter;
import com.furnaceintel.pipeline.output.PointSpool;
import com.furnaceintel.pipeline.output.PointWriteException;
import com.furnaceintel.pipeline.output.PointWritePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Drives the fetch → decode → build → write → ledger cycle.
 *
 * A backfill is split into (date, range) units, two half-day ranges per date. Every unit runs
 * to completion on its own: a failure is logged, recorded as a failed run and the sweep moves
 * on. Live polls are single units whose fetch failure is fatal to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private static final int[] RANGES = {1, 2};

    private final FurnaceDataSource dataSource;
    private final PayloadDecoder decoder;
    private final TimestampResolver timestamps;
    private final PointBuilder pointBuilder;
    private final PointWritePipeline writePipeline;
    private final CsvTableExporter csvExporter;
    private final RunLedger ledger;
    private final RunLogFiles runLogs;
    private final FurnacePipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * One live poll, stretched to the configured cadence.
     *
     * @throws FetchException if the live endpoint cannot be read
     */
    public RunRecord runLive(RunOptions options) {
        Instant started = clock.instant();
        ZonedDateTime nowUtc = started.atZone(ZoneOffset.UTC);
        log.info("Live mode - run for timestamp UTC at {}", nowUtc);

        Unit unit = new Unit(RunMode.LIVE,
                nowUtc.format(apiDateFormat()),
                nowUtc.format(fileDateFormat()),
                nowUtc.format(fileTimeFormat()),
                0,
                true,
                dataSource::fetchLive);
        RunRecord record = process(unit, options, null);

        Duration elapsed = Duration.between(started, clock.instant());
        Duration remaining = remainingCadence(properties.getLive().getCadence(), elapsed);
        if (remaining.isZero()) {
            log.warn("Live poll took {} ms, exceeding the {} ms cadence; continuing without pause",
                    elapsed.toMillis(), properties.getLive().getCadence().toMillis());
        } else {
            log.debug("Live poll took {} ms, waiting {} ms", elapsed.toMillis(), remaining.toMillis());
            sleep(remaining);
        }
        return record;
    }

    /** Both half-day ranges of one date. */
    public List<RunRecord> runDaily(LocalDate date, RunOptions options, Set<String> variables) {
        return runRange(date, date, options, variables);
    }

    /**
     * Every (date, range) unit in {@code [start, end]}.
     *
     * @param variables optional allow-list of raw variable names; null keeps everything
     */
    public List<RunRecord> runRange(LocalDate start, LocalDate end, RunOptions options, Set<String> variables) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        log.info("Processing date range {} to {}{}", start, end,
                variables == null ? "" : " restricted to " + variables.size() + " variables");

        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<RunRecord> results = new ArrayList<>();
        boolean first = true;
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            boolean ledgerEligible = !date.equals(today);
            if (!ledgerEligible) {
                log.info("Skip logging the run details for {} as data is still being loaded for today", date);
            }
            for (int range : RANGES) {
                if (!first) {
                    sleep(properties.getApi().getUnitDelay());
                }
                first = false;
                LocalDate day = date;
                Unit unit = new Unit(RunMode.DAILY,
                        date.format(apiDateFormat()),
                        date.format(fileDateFormat()),
                        String.valueOf(range),
                        range,
                        ledgerEligible,
                        () -> dataSource.fetchDaily(day, range));
                results.add(process(unit, options, variables));
            }
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Range {} to {} complete: {} units, {} failed", start, end, results.size(), failed);
        return results;
    }

    /** Time left in the cadence window, or zero when the poll overran it. */
    static Duration remainingCadence(Duration cadence, Duration elapsed) {
        Duration remaining = cadence.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RunRecord process(Unit unit, RunOptions options, Set<String> variables) {
        Progress progress = new Progress();
        boolean success = false;

        RunLogFiles.RunLog runLog = runLogs.open(unit.mode().label(), unit.dateFile(), unit.qualifier());
        try {
            Instant st = clock.instant();
            String raw = fetch(unit);
            log.info("Fetched raw data for {} range {} in {} ms",
                    unit.dateRun(), unit.qualifier(), Duration.between(st, clock.instant()).toMillis());

            List<RawRecord> records = decoder.decode(raw);
            progress.numRecords = records.size();

            ingest(records, unit, options, variables, progress);
            success = true;

        } catch (FetchException e) {
            if (unit.mode() == RunMode.LIVE) {
                log.error("Live fetch failed: {}", e.getMessage(), e);
                runLog.close();
                throw e;
            }
            log.error("Fetch failed for {} range {}: {}", unit.dateRun(), unit.qualifier(), e.getMessage(), e);
        } catch (DecodeException e) {
            log.error("Decode failed for {} range {}: {}", unit.dateRun(), unit.qualifier(), e.getMessage());
        } catch (PointWriteException e) {
            progress.linesAttempted = e.getLinesAttempted();
            log.error("Write failed for {} range {} after {} lines attempted: {}",
                    unit.dateRun(), unit.qualifier(), e.getLinesAttempted(), e.getMessage(), e);
        } catch (Exception e) {
            log.error("Processing failed for {} range {}: {}", unit.dateRun(), unit.qualifier(), e.getMessage(), e);
        }

        RunRecord record = RunRecord.builder()
                .runTime(clock.instant().toString())
                .dateRun(unit.dateRun())
                .range(unit.qualifier())
                .mode(unit.mode().label())
                .parameters(parameters(unit, options, variables, progress))
                .processId(ProcessHandle.current().pid())
                .success(success)
                .numRecords(progress.numRecords)
                .logPath(runLog.path().toString())
                .pointsFilePath(progress.archive == null ? null : progress.archive.toString())
                .build();
        runLog.close();

        if (options.logRun() && unit.ledgerEligible()) {
            try {
                ledger.upsert(record);
            } catch (DataAccessException e) {
                log.warn("Failed to log run {} range {}: {}", unit.dateRun(), unit.qualifier(), e.getMessage());
            }
        }
        return record;
    }

    private void ingest(List<RawRecord> records, Unit unit, RunOptions options, Set<String> variables,
                        Progress progress) {
        PointSpool spool = writePipeline.openSpool();
        try {
            int points = 0;
            int untimed = 0;
            for (RawRecord record : records) {
                RawRecord r = variables == null ? record : record.restrictTo(variables);
                Optional<Instant> ts = timestamps.resolve(r);
                if (ts.isEmpty()) {
                    untimed++;
                    continue;
                }
                progress.lastTimestamp = ts.get();
                List<Point> built = pointBuilder.build(r, ts.get());
                points += writePipeline.spool(spool, built, options);
            }
            if (untimed > 0) {
                log.warn("{} of {} records had no usable {} and were not written",
                        untimed, records.size(), RawRecord.TIMESTAMP_FIELD);
            }
            log.info("Spooled {} points from {} records", points, records.size());

            if (properties.getOutput().isCsvExport()) {
                csvExporter.export(records, unit.dateFile());
            }

            if (options.dbWrite()) {
                Instant st = clock.instant();
                progress.linesAttempted = writePipeline.flush(spool);
                log.info("Write to InfluxDB took {} ms", Duration.between(st, clock.instant()).toMillis());
            }
        } finally {
            if (options.retainFile()) {
                progress.archive = writePipeline.archive(spool, artifactName(unit, progress.lastTimestamp));
            } else {
                writePipeline.discard(spool);
            }
        }
    }

    /** Any fetch failure, whatever its type, is reported as a {@link FetchException}. */
    private static String fetch(Unit unit) {
        try {
            return unit.fetch().get();
        } catch (FetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FetchException("Fetch failed: " + e.getMessage(), e);
        }
    }

    private String artifactName(Unit unit, Instant lastTimestamp) {
        if (unit.mode() == RunMode.DAILY) {
            return PointWritePipeline.dailyArtifactName(unit.dateFile(), unit.range());
        }
        String time = lastTimestamp == null
                ? unit.qualifier()
                : lastTimestamp.atZone(ZoneOffset.UTC).format(fileTimeFormat());
        return PointWritePipeline.liveArtifactName(unit.dateFile(), time);
    }

    private String parameters(Unit unit, RunOptions options, Set<String> variables, Progress progress) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("mode", unit.mode().label());
        params.put("date", unit.dateRun());
        params.put("range", unit.qualifier());
        params.put("dbWrite", options.dbWrite());
        params.put("override", options.override());
        params.put("retainFile", options.retainFile());
        params.put("logRun", options.logRun());
        params.put("variables", variables == null ? null : variables.size());
        params.put("linesAttempted", progress.linesAttempted);
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize run parameters", e);
        }
    }

    private DateTimeFormatter apiDateFormat() {
        return DateTimeFormatter.ofPattern(properties.getApi().getDateFormat());
    }

    private DateTimeFormatter fileDateFormat() {
        return DateTimeFormatter.ofPattern(properties.getOutput().getDateFormatFilename());
    }

    private DateTimeFormatter fileTimeFormat() {
        return DateTimeFormatter.ofPattern(properties.getOutput().getTimeFormatFilename());
    }

    private void sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) return;
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One (date, range) unit, or one live poll.
     *
     * @param dateRun        ledger date, MM-dd-yyyy
     * @param dateFile       file-name date, yyyyMMdd
     * @param qualifier      range number, or HHmmss for live
     * @param ledgerEligible false for today's units, whose data is still incomplete
     */
    private record Unit(RunMode mode, String dateRun, String dateFile, String qualifier, int range,
                        boolean ledgerEligible, Supplier<String> fetch) {}

    private static final class Progress {
        int numRecords;
        /** Lines sent to the store, including a failed batch; null when nothing was flushed. */
        Integer linesAttempted;
        Instant lastTimestamp;
        Path archive;
    }
}

package com.furnaceintel.pipeline.scheduler;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.RunOptions;
import com.furnaceintel.pipeline.service.IngestionOrchestrator;
import com.furnaceintel.pipeline.service.VariableAllowList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;

/**
 * One-shot command line entry point.
 *
 * <pre>
 *   --mode=live
 *   --mode=daily [--date=MM-dd-yyyy]
 *   --mode=daily --startdate=MM-dd-yyyy --enddate=MM-dd-yyyy [--variable-file=vars.txt]
 *   flags: --db-write --override --retain-file --log-run (true/false, 1/0, yes/no)
 * </pre>
 *
 * Without --mode the application keeps running as a service.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final DateTimeFormatter CLI_DATE = DateTimeFormatter.ofPattern("MM-dd-yyyy");

    private final IngestionOrchestrator orchestrator;
    private final FurnacePipelineProperties properties;
    private final Clock clock;

    private volatile boolean oneShot;
    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        String mode = option(args, "mode");
        if (mode == null) {
            log.info("No --mode given; running as a service");
            return;
        }
        oneShot = true;
        try {
            exitCode = execute(mode, args);
        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    public boolean isOneShot() {
        return oneShot;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private int execute(String mode, ApplicationArguments args) {
        FurnacePipelineProperties.Run defaults = properties.getRun();
        RunOptions options = new RunOptions(
                flag(args, "db-write", defaults.isDbWrite()),
                flag(args, "override", defaults.isOverride()),
                flag(args, "retain-file", defaults.isRetainFile()),
                flag(args, "log-run", defaults.isLogRun()));
        log.info("Parsed CLI args: mode={}, {}", mode, options);

        switch (mode) {
            case "live" -> {
                orchestrator.runLive(options);
                return 0;
            }
            case "daily" -> {
                return runDaily(args, options);
            }
            default -> {
                log.error("Unknown mode '{}'; expected live or daily", mode);
                return 1;
            }
        }
    }

    private int runDaily(ApplicationArguments args, RunOptions options) {
        String date = option(args, "date");
        String start = option(args, "startdate");
        String end = option(args, "enddate");

        if (start != null && start.equals(end)) {
            log.info("Start date {} is the same as end date {}. Triggering daily mode.", start, end);
            date = start;
            start = null;
            end = null;
        }

        String variableFile = option(args, "variable-file");
        Set<String> variables = variableFile == null ? null : VariableAllowList.read(Paths.get(variableFile));

        try {
            if (start != null && end != null) {
                LocalDate from = LocalDate.parse(start, CLI_DATE);
                LocalDate to = LocalDate.parse(end, CLI_DATE);
                if (from.isAfter(to)) {
                    log.error("Start date {} is after end date {}", start, end);
                    return 1;
                }
                orchestrator.runRange(from, to, options, variables);
                return 0;
            }
            if (start != null || end != null) {
                log.error("Both --startdate and --enddate are required for a range run");
                return 1;
            }
            LocalDate day = date != null
                    ? LocalDate.parse(date, CLI_DATE)
                    : LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
            log.debug("Daily mode - processing date: {}", day);
            orchestrator.runDaily(day, options, variables);
            return 0;
        } catch (DateTimeParseException e) {
            log.error("Dates must be MM-dd-yyyy: {}", e.getMessage());
            return 1;
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean flag(ApplicationArguments args, String name, boolean defaultValue) {
        if (!args.containsOption(name)) return defaultValue;
        String value = option(args, name);
        // A bare --flag means true.
        if (value == null) return true;
        return switch (value.toLowerCase()) {
            case "true", "1", "yes" -> true;
            default -> false;
        };
    }
}

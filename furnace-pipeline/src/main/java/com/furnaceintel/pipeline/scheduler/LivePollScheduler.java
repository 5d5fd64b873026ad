package com.furnaceintel.pipeline.scheduler;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.ledger.RunLedger;
import com.furnaceintel.pipeline.model.RunOptions;
import com.furnaceintel.pipeline.service.FetchException;
import com.furnaceintel.pipeline.service.IngestionOrchestrator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages the run ledger schema and continuous live polling.
 *
 * Each poll stretches itself to furnace.live.cadence, so back-to-back polls land on a steady
 * wall-clock period. A failed live fetch has no sibling unit to fall back on and stops the
 * service with exit code 1.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LivePollScheduler {

    private final IngestionOrchestrator orchestrator;
    private final RunLedger runLedger;
    private final FurnacePipelineProperties properties;
    private final PipelineCommandRunner commandRunner;
    private final ApplicationContext context;

    private volatile boolean halted;

    /**
     * On application startup:
     *  1. Always ensure the run ledger table exists
     *  2. Report whether live polling is on
     */
    @PostConstruct
    public void onStartup() {
        try {
            runLedger.init();
        } catch (Exception e) {
            log.warn("Could not initialise run ledger: {}", e.getMessage());
        }

        if (properties.getLive().isEnabled()) {
            log.info("Live polling enabled with cadence {}", properties.getLive().getCadence());
        } else {
            log.info("Pipeline ready. Live polling disabled (furnace.live.enabled=false).");
        }
    }

    @Scheduled(fixedDelayString = "${furnace.live.poll-gap-ms:1000}",
            initialDelayString = "${furnace.live.poll-gap-ms:1000}")
    public void poll() {
        if (!properties.getLive().isEnabled() || halted || commandRunner.isOneShot()) {
            return;
        }
        try {
            orchestrator.runLive(RunOptions.defaults(properties.getRun()));
        } catch (FetchException e) {
            log.error("Live fetch failed, shutting down: {}", e.getMessage(), e);
            halted = true;
            new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "live-poll-shutdown").start();
        } catch (Exception e) {
            log.error("Live poll failed: {}", e.getMessage(), e);
        }
    }
}

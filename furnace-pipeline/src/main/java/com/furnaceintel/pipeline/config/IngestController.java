package com.furnaceintel.pipeline.config;

import com.furnaceintel.pipeline.ledger.RunLedger;
import com.furnaceintel.pipeline.model.RunOptions;
import com.furnaceintel.pipeline.model.RunRecord;
import com.furnaceintel.pipeline.service.IngestionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestController {

    private final IngestionOrchestrator orchestrator;
    private final RunLedger runLedger;
    private final FurnacePipelineProperties properties;

    // ── Ingest triggers ───────────────────────────────────────────────────────

    @PostMapping("/ingest/trigger/live")
    public ResponseEntity<Map<String, String>> triggerLive() {
        RunOptions options = RunOptions.defaults(properties.getRun());
        new Thread(() -> {
            try {
                orchestrator.runLive(options);
            } catch (Exception e) {
                log.error("Manual live poll failed: {}", e.getMessage(), e);
            }
        }, "manual-ingest-live").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "live"));
    }

    /**
     * Re-ingest both ranges of one date.
     *
     * POST /ingest/trigger/2025-05-29
     */
    @PostMapping("/ingest/trigger/{date}")
    public ResponseEntity<Map<String, String>> triggerDate(@PathVariable String date) {
        LocalDate day;
        try {
            day = LocalDate.parse(date);
        } catch (Exception e) {
            return ResponseEntity.badRequest().body(Map.of("error", "date must be YYYY-MM-DD"));
        }
        RunOptions options = RunOptions.defaults(properties.getRun());
        new Thread(() -> orchestrator.runDaily(day, options, null), "manual-ingest-" + date).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", date));
    }

    /**
     * Selective or full backfill.
     *
     * POST /ingest/backfill?start=2025-05-01&end=2025-05-07&variables=TAG_A,TAG_B
     */
    @PostMapping("/ingest/backfill")
    public ResponseEntity<Map<String, String>> backfill(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) List<String> variables) {
        if (start.isAfter(end)) {
            return ResponseEntity.badRequest().body(Map.of("error", "start must not be after end"));
        }
        Set<String> allowList = variables == null || variables.isEmpty() ? null : new LinkedHashSet<>(variables);
        RunOptions options = RunOptions.defaults(properties.getRun());
        new Thread(() -> orchestrator.runRange(start, end, options, allowList), "manual-backfill").start();
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "start", start.toString(),
                "end", end.toString()));
    }

    @GetMapping("/ingest/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "furnace-pipeline",
                "version", "1.0.0",
                "liveEnabled", properties.getLive().isEnabled(),
                "bucket", String.valueOf(properties.getInflux().getBucket())
        ));
    }

    // ── Run ledger ────────────────────────────────────────────────────────────

    @GetMapping("/ingest/runs")
    public ResponseEntity<?> runs() {
        try {
            List<RunRecord> runs = runLedger.findAll();
            return ResponseEntity.ok(runs);
        } catch (Exception e) {
            log.error("Run ledger query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}

package com.furnaceintel.pipeline.config;

import com.furnaceintel.pipeline.ledger.RunLedger;
import com.furnaceintel.pipeline.model.RunOptions;
import com.furnaceintel.pipeline.model.RunRecord;
import com.furnaceintel.pipeline.service.IngestionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IngestControllerTest {

    private IngestionOrchestrator orchestrator;
    private RunLedger runLedger;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(IngestionOrchestrator.class);
        runLedger = mock(RunLedger.class);
        FurnacePipelineProperties properties = new FurnacePipelineProperties();
        properties.getInflux().setBucket("bf2");
        mockMvc = MockMvcBuilders
                .standaloneSetup(new IngestController(orchestrator, runLedger, properties))
                .build();
    }

    @Test
    void shouldAcceptDateTrigger() throws Exception {
        mockMvc.perform(post("/ingest/trigger/2025-05-29"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.target").value("2025-05-29"));

        verify(orchestrator, timeout(2000)).runDaily(eq(LocalDate.of(2025, 5, 29)), any(RunOptions.class), eq(null));
    }

    @Test
    void shouldRejectMalformedDate() throws Exception {
        mockMvc.perform(post("/ingest/trigger/29-05-2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldAcceptLiveTrigger() throws Exception {
        mockMvc.perform(post("/ingest/trigger/live"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.target").value("live"));

        verify(orchestrator, timeout(2000)).runLive(any(RunOptions.class));
    }

    @Test
    void shouldStartSelectiveBackfill() throws Exception {
        mockMvc.perform(post("/ingest/backfill")
                        .param("start", "2025-05-01")
                        .param("end", "2025-05-07")
                        .param("variables", "BF2_HOT_BLAST_TEMP,BF2_TOP_PRESSURE"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.start").value("2025-05-01"))
                .andExpect(jsonPath("$.end").value("2025-05-07"));

        verify(orchestrator, timeout(2000)).runRange(
                eq(LocalDate.of(2025, 5, 1)),
                eq(LocalDate.of(2025, 5, 7)),
                any(RunOptions.class),
                eq(Set.of("BF2_HOT_BLAST_TEMP", "BF2_TOP_PRESSURE")));
    }

    @Test
    void shouldRejectReversedBackfill() throws Exception {
        mockMvc.perform(post("/ingest/backfill")
                        .param("start", "2025-05-07")
                        .param("end", "2025-05-01"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldListRuns() throws Exception {
        when(runLedger.findAll()).thenReturn(List.of(RunRecord.builder()
                .runTime("2025-05-30T01:00:00Z")
                .dateRun("05-29-2025")
                .range("1")
                .mode("daily")
                .success(true)
                .numRecords(720)
                .build()));

        mockMvc.perform(get("/ingest/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].dateRun").value("05-29-2025"))
                .andExpect(jsonPath("$[0].numRecords").value(720))
                .andExpect(jsonPath("$[0].success").value(true));
    }

    @Test
    void shouldReportLedgerFailure() throws Exception {
        when(runLedger.findAll()).thenThrow(new DataAccessResourceFailureException("database is locked"));

        mockMvc.perform(get("/ingest/runs"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("database is locked"));
    }

    @Test
    void shouldReportStatus() throws Exception {
        mockMvc.perform(get("/ingest/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("furnace-pipeline"))
                .andExpect(jsonPath("$.liveEnabled").value(false))
                .andExpect(jsonPath("$.bucket").value("bf2"));
    }
}

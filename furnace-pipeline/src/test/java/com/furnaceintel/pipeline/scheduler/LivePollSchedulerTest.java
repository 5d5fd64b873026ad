package com.furnaceintel.pipeline.scheduler;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.ledger.RunLedger;
import com.furnaceintel.pipeline.model.RunOptions;
import com.furnaceintel.pipeline.service.IngestionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LivePollSchedulerTest {

    private IngestionOrchestrator orchestrator;
    private RunLedger ledger;
    private PipelineCommandRunner commandRunner;
    private FurnacePipelineProperties properties;
    private LivePollScheduler scheduler;

    @BeforeEach
    void setUp() {
        orchestrator = mock(IngestionOrchestrator.class);
        ledger = mock(RunLedger.class);
        commandRunner = mock(PipelineCommandRunner.class);
        properties = new FurnacePipelineProperties();
        scheduler = new LivePollScheduler(orchestrator, ledger, properties, commandRunner, mock(ApplicationContext.class));
    }

    @Test
    void shouldInitialiseLedgerOnStartup() {
        scheduler.onStartup();

        verify(ledger).init();
    }

    @Test
    void shouldSurviveLedgerInitFailure() {
        doThrow(new DataAccessResourceFailureException("unable to open database file")).when(ledger).init();

        assertThatCode(scheduler::onStartup).doesNotThrowAnyException();
    }

    @Test
    void shouldNotPollWhenDisabled() {
        scheduler.poll();

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldNotPollDuringOneShotCommand() {
        properties.getLive().setEnabled(true);
        when(commandRunner.isOneShot()).thenReturn(true);

        scheduler.poll();

        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldPollWithDefaultOptions() {
        properties.getLive().setEnabled(true);
        properties.getRun().setDbWrite(true);

        scheduler.poll();
        scheduler.poll();

        verify(orchestrator, times(2)).runLive(new RunOptions(true, true, false, false));
    }

    @Test
    void shouldKeepPollingAfterNonFetchFailure() {
        properties.getLive().setEnabled(true);
        when(orchestrator.runLive(any(RunOptions.class))).thenThrow(new IllegalStateException("disk full"));

        scheduler.poll();
        scheduler.poll();

        verify(orchestrator, times(2)).runLive(any(RunOptions.class));
    }
}

package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.Point;
import com.furnaceintel.pipeline.model.RunOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PointWritePipelineTest {

    private static final RunOptions WRITE = new RunOptions(true, true, false, false);

    @TempDir
    Path outputDir;

    private final List<List<String>> sentBatches = new ArrayList<>();
    private FurnacePipelineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new FurnacePipelineProperties();
        properties.getOutput().setDir(outputDir.toString());
        properties.getInflux().setBatchSize(2);
        properties.getInflux().setMaxRetries(0);
        properties.getInflux().setRetryInterval(Duration.ofMillis(1));
        properties.getInflux().setWriteDelay(Duration.ZERO);
    }

    private PointWritePipeline pipeline(TimeSeriesStore store, ExistenceChecker checker) {
        return new PointWritePipeline(new BatchWriter(store, properties), checker, properties);
    }

    private TimeSeriesStore recordingStore() {
        return lines -> sentBatches.add(List.copyOf(lines));
    }

    private static List<Point> points(int count) {
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            points.add(new Point("delta_t", Map.of("bosh", (double) i), 1748476800L + i));
        }
        return points;
    }

    @Test
    void shouldSendSpooledLinesInBatches() {
        PointWritePipeline pipeline = pipeline(recordingStore(), ExistenceChecker.none());
        PointSpool spool = pipeline.openSpool();

        assertThat(pipeline.spool(spool, points(5), WRITE)).isEqualTo(5);
        int written = pipeline.flush(spool);

        assertThat(written).isEqualTo(5);
        assertThat(sentBatches).extracting(List::size).containsExactly(2, 2, 1);
        assertThat(sentBatches.get(0).get(0)).isEqualTo("delta_t bosh=0.0 1748476800");
    }

    @Test
    void shouldStopAtFirstFailedBatch() {
        TimeSeriesStore failingSecondBatch = lines -> {
            if (sentBatches.size() == 1) {
                throw new StoreException("write refused", null);
            }
            sentBatches.add(List.copyOf(lines));
        };
        PointWritePipeline pipeline = pipeline(failingSecondBatch, ExistenceChecker.none());
        PointSpool spool = pipeline.openSpool();
        pipeline.spool(spool, points(5), WRITE);

        assertThatThrownBy(() -> pipeline.flush(spool))
                .isInstanceOfSatisfying(PointWriteException.class, e -> {
                    assertThat(e.getLinesAttempted()).isEqualTo(4);
                    assertThat(e.getError().batchIndex()).isEqualTo(1);
                    assertThat(e.getMessage()).contains("write refused");
                });
        assertThat(sentBatches).hasSize(1);
    }

    @Test
    void shouldSkipExistingPointsWithoutOverride() {
        ExistenceChecker odd = (measurement, tags, ts) -> ts.getEpochSecond() % 2 == 1;
        PointWritePipeline pipeline = pipeline(recordingStore(), odd);
        PointSpool spool = pipeline.openSpool();

        int spooled = pipeline.spool(spool, points(4), new RunOptions(true, false, false, false));

        assertThat(spooled).isEqualTo(2);
        assertThat(spool.lineCount()).isEqualTo(2);
    }

    @Test
    void shouldNotQueryStoreWhenNotWriting() {
        ExistenceChecker unreachable = (measurement, tags, ts) -> {
            throw new AssertionError("existence check must not run");
        };
        PointWritePipeline pipeline = pipeline(recordingStore(), unreachable);
        PointSpool spool = pipeline.openSpool();

        assertThat(pipeline.spool(spool, points(3), new RunOptions(false, false, true, false))).isEqualTo(3);
    }

    @Test
    void shouldArchiveSpoolAsGzip() throws Exception {
        PointWritePipeline pipeline = pipeline(recordingStore(), ExistenceChecker.none());
        PointSpool spool = pipeline.openSpool();
        pipeline.spool(spool, points(3), WRITE);

        Path archived = pipeline.archive(spool, PointWritePipeline.dailyArtifactName("20250529", 1));

        assertThat(archived).isEqualTo(outputDir.resolve("date_20250529_Range1.txt.gz"));
        assertThat(archived).exists();
        assertThat(spool.path()).doesNotExist();
        assertThat(outputDir.resolve("date_20250529_Range1.txt")).doesNotExist();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(archived)), StandardCharsets.UTF_8))) {
            assertThat(reader.lines().collect(Collectors.toList())).containsExactly(
                    "delta_t bosh=0.0 1748476800",
                    "delta_t bosh=1.0 1748476801",
                    "delta_t bosh=2.0 1748476802");
        }
    }

    @Test
    void shouldDiscardSpool() {
        PointWritePipeline pipeline = pipeline(recordingStore(), ExistenceChecker.none());
        PointSpool spool = pipeline.openSpool();
        pipeline.spool(spool, points(1), WRITE);

        pipeline.discard(spool);

        assertThat(spool.path()).doesNotExist();
    }

    @Test
    void shouldKeepOverlappingRunsApart() {
        PointWritePipeline pipeline = pipeline(recordingStore(), ExistenceChecker.none());
        PointSpool first = pipeline.openSpool();
        pipeline.spool(first, points(2), WRITE);

        PointSpool second = pipeline.openSpool();
        pipeline.spool(second, points(1), WRITE);

        assertThat(second.path()).isNotEqualTo(first.path());
        assertThat(second.path().getFileName().toString())
                .startsWith("tmp_" + ProcessHandle.current().pid() + "_")
                .endsWith(".txt");
        assertThat(pipeline.flush(first)).isEqualTo(2);

        pipeline.discard(second);
        assertThat(first.path()).exists();
        assertThat(pipeline.flush(first)).isEqualTo(2);
    }

    @Test
    void shouldNameArtifacts() {
        assertThat(PointWritePipeline.dailyArtifactName("20250529", 2)).isEqualTo("date_20250529_Range2.txt");
        assertThat(PointWritePipeline.liveArtifactName("20250529", "143000")).isEqualTo("live_20250529_143000.txt");
    }
}

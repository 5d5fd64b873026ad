package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.BatchResult;
import com.furnaceintel.pipeline.model.Point;
import com.furnaceintel.pipeline.model.RunOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

/**
 * Moves one run's points from the spool into the time-series store and, when asked, keeps a
 * gzip audit copy.
 *
 * Lines are sent in batches of {@code furnace.influx.batch-size}. A batch that exhausts its
 * retries stops the flush with {@link PointWriteException}; batches already committed are
 * left in place.
 */
@Component
@Slf4j
public class PointWritePipeline {

    private static final Map<String, String> NO_TAGS = Map.of();

    private final BatchWriter batchWriter;
    private final ExistenceChecker existenceChecker;
    private final FurnacePipelineProperties properties;
    private final Path outputDir;

    public PointWritePipeline(BatchWriter batchWriter,
                              ExistenceChecker existenceChecker,
                              FurnacePipelineProperties properties) {
        this.batchWriter = batchWriter;
        this.existenceChecker = existenceChecker;
        this.properties = properties;
        this.outputDir = Paths.get(properties.getOutput().getDir());
    }

    public PointSpool openSpool() {
        return PointSpool.open(outputDir, ProcessHandle.current().pid());
    }

    /**
     * Appends points to the spool. Without override, points the store already holds are dropped
     * first.
     *
     * @return number of points spooled
     */
    public int spool(PointSpool spool, List<Point> points, RunOptions options) {
        List<Point> toWrite = points;
        if (options.dbWrite() && !options.override()) {
            toWrite = new ArrayList<>(points.size());
            for (Point p : points) {
                if (existenceChecker.exists(p.measurement(), NO_TAGS, Instant.ofEpochSecond(p.epochSeconds()))) {
                    log.debug("Skipping existing point {} at {}", p.measurement(), p.epochSeconds());
                } else {
                    toWrite.add(p);
                }
            }
        }
        spool.append(toWrite);
        return toWrite.size();
    }

    /**
     * Writes every spooled line to the store.
     *
     * @return lines written
     * @throws PointWriteException when a batch cannot be written
     */
    public int flush(PointSpool spool) {
        int batchSize = Math.max(1, properties.getInflux().getBatchSize());
        log.info("Writing {} to {} in batches of {}", spool.path(), properties.getInflux().getBucket(), batchSize);

        int written = 0;
        int batchIndex = 0;
        List<String> batch = new ArrayList<>(Math.min(batchSize, 1024));
        try (BufferedReader reader = Files.newBufferedReader(spool.path(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                batch.add(line.strip());
                if (batch.size() >= batchSize) {
                    if (batchIndex > 0) pause();
                    written += send(batchIndex++, batch, written);
                    batch = new ArrayList<>(Math.min(batchSize, 1024));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read spool file " + spool.path(), e);
        }
        if (!batch.isEmpty()) {
            if (batchIndex > 0) pause();
            written += send(batchIndex, batch, written);
        }

        log.info("Finished writing {} lines from {}", written, spool.path());
        return written;
    }

    private int send(int batchIndex, List<String> batch, int writtenSoFar) {
        BatchResult result = batchWriter.write(batchIndex, batch);
        if (!result.isCommitted()) {
            throw new PointWriteException(result.error(), writtenSoFar + batch.size());
        }
        log.info("Wrote batch {} of {} lines. Total written: {}", batchIndex, batch.size(), writtenSoFar + batch.size());
        return batch.size();
    }

    private void pause() {
        Duration delay = properties.getInflux().getWriteDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    // ── Audit artifacts ─────────────────────────────────────────────────────

    /** {@code date_<yyyyMMdd>_Range<r>.txt} */
    public static String dailyArtifactName(String dateFile, int range) {
        return "date_" + dateFile + "_Range" + range + ".txt";
    }

    /** {@code live_<yyyyMMdd>_<HHmmss>.txt} */
    public static String liveArtifactName(String dateFile, String timeFile) {
        return "live_" + dateFile + "_" + timeFile + ".txt";
    }

    /** Where {@link #archive} puts the compressed copy for the given artifact name. */
    public Path archivePath(String artifactName) {
        return outputDir.resolve(artifactName + ".gz");
    }

    /**
     * Renames the spool to its canonical name, gzips it in place and removes the uncompressed file.
     *
     * @return path of the .gz file
     */
    public Path archive(PointSpool spool, String artifactName) {
        Path target = outputDir.resolve(artifactName);
        Path gzipped = archivePath(artifactName);
        try {
            log.info("Renaming file {} to {}", spool.path(), target);
            Files.move(spool.path(), target, StandardCopyOption.REPLACE_EXISTING);
            try (InputStream in = Files.newInputStream(target);
                 OutputStream out = new GZIPOutputStream(Files.newOutputStream(gzipped))) {
                in.transferTo(out);
            }
            Files.delete(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot archive points to " + gzipped, e);
        }
        log.info("Gzipped points file to {}", gzipped);
        return gzipped;
    }

    public void discard(PointSpool spool) {
        try {
            if (Files.deleteIfExists(spool.path())) {
                log.info("Removed temporary file {}", spool.path());
            }
        } catch (IOException e) {
            log.warn("Failed to remove temporary file {}: {}", spool.path(), e.getMessage());
        }
    }
}

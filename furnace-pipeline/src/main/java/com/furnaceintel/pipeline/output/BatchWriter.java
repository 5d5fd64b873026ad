package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.BatchResult;
import com.furnaceintel.pipeline.model.WriteError;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes one batch with bounded retry.
 *
 * Attempt 1 is the initial write; each failure waits {@code retryInterval * base^(n-1)},
 * capped at {@code maxRetryDelay}, until {@code maxRetries} retries are spent. The outcome is
 * returned, never thrown.
 */
@Component
@Slf4j
public class BatchWriter {

    private final TimeSeriesStore store;
    private final int maxRetries;
    private final IntervalFunction backoff;

    public BatchWriter(TimeSeriesStore store, FurnacePipelineProperties properties) {
        FurnacePipelineProperties.Influx influx = properties.getInflux();
        this.store = store;
        this.maxRetries = Math.max(0, influx.getMaxRetries());
        long initial = Math.max(1, influx.getRetryInterval().toMillis());
        long max = Math.max(initial, influx.getMaxRetryDelay().toMillis());
        this.backoff = IntervalFunction.ofExponentialBackoff(initial, Math.max(1.0, influx.getExponentialBase()), max);
    }

    public BatchResult write(int batchIndex, List<String> lines) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                store.write(lines);
                if (attempt > 1) {
                    log.info("Batch {} committed on attempt {}", batchIndex, attempt);
                }
                return BatchResult.committed(batchIndex, lines.size(), attempt);
            } catch (RuntimeException e) {
                if (attempt > maxRetries) {
                    WriteError error = new WriteError(batchIndex, lines.size(), attempt, e);
                    log.error("Giving up on {}", error.message());
                    return BatchResult.failed(error);
                }
                long waitMs = backoff.apply(attempt);
                log.warn("Batch {} attempt {}/{} failed, retrying in {} ms: {}",
                        batchIndex, attempt, maxRetries + 1, waitMs, e.getMessage());
                if (!sleep(waitMs)) {
                    return BatchResult.failed(new WriteError(batchIndex, lines.size(), attempt, e));
                }
            }
        }
    }

    private boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

package com.furnaceintel.pipeline.model;

/**
 * A batch that could not be written after every retry.
 *
 * @param batchIndex zero-based batch number within the run
 * @param lines      lines in the failed batch
 * @param attempts   write attempts made, including the first
 * @param cause      last failure reported by the store
 */
public record WriteError(int batchIndex, int lines, int attempts, Throwable cause) {

    public String message() {
        return String.format("batch %d (%d lines) failed after %d attempts: %s",
                batchIndex, lines, attempts, cause == null ? "unknown" : cause.getMessage());
    }
}

package com.furnaceintel.pipeline.model;

import java.util.Optional;

/**
 * Outcome of one batch write: either committed after some number of attempts, or failed with
 * a {@link WriteError}.
 */
public record BatchResult(int batchIndex, int lines, int attempts, WriteError error) {

    public static BatchResult committed(int batchIndex, int lines, int attempts) {
        return new BatchResult(batchIndex, lines, attempts, null);
    }

    public static BatchResult failed(WriteError error) {
        return new BatchResult(error.batchIndex(), error.lines(), error.attempts(), error);
    }

    public boolean isCommitted() {
        return error == null;
    }

    public Optional<WriteError> writeError() {
        return Optional.ofNullable(error);
    }
}

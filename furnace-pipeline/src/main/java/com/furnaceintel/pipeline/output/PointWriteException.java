package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.model.WriteError;

/**
 * A batch exhausted its retries. Batches before it stay written.
 */
public class PointWriteException extends RuntimeException {

    private final transient WriteError error;
    private final int linesAttempted;

    public PointWriteException(WriteError error, int linesAttempted) {
        super(error.message(), error.cause());
        this.error = error;
        this.linesAttempted = linesAttempted;
    }

    public WriteError getError() {
        return error;
    }

    /** Lines sent to the store so far, including the failed batch. */
    public int getLinesAttempted() {
        return linesAttempted;
    }
}

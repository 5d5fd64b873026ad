package com.furnaceintel.pipeline.output;

import java.util.List;

/** Accepts batches of line-protocol lines at second precision. */
public interface TimeSeriesStore {

    /**
     * Writes one batch in a single call.
     *
     * @throws StoreException if the store rejects or cannot be reached
     */
    void write(List<String> lines);
}

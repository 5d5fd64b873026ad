package com.furnaceintel.pipeline.model;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;

/**
 * Per-run switches.
 *
 * @param dbWrite    write points to the time-series store
 * @param override   re-write every point; when false, points already in the store are skipped
 * @param retainFile keep a gzip audit copy of the emitted lines
 * @param logRun     record the run in the ledger
 */
public record RunOptions(boolean dbWrite, boolean override, boolean retainFile, boolean logRun) {

    public static RunOptions defaults(FurnacePipelineProperties.Run run) {
        return new RunOptions(run.isDbWrite(), run.isOverride(), run.isRetainFile(), run.isLogRun());
    }
}

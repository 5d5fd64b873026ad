package com.furnaceintel.pipeline.model;

import lombok.Builder;
import lombok.Data;

/**
 * Tracks each pipeline run for observability and safe re-runs.
 * Stored in the runs table of the local ledger; (dateRun, range, mode) is the natural key.
 */
@Data
@Builder
public class RunRecord {

    private String runTime;          // ISO-8601 UTC
    private String dateRun;          // MM-dd-yyyy
    private String range;            // "1" | "2", or HHmmss for live polls
    private String mode;             // live | daily
    private String parameters;       // JSON
    private long processId;
    private boolean success;
    private int numRecords;
    private String logPath;
    private String pointsFilePath;   // null unless the audit file was retained
}

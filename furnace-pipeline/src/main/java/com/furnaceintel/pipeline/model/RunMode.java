package com.furnaceintel.pipeline.model;

public enum RunMode {
    LIVE, DAILY;

    /** Lower-case form used in file names and the ledger. */
    public String label() {
        return name().toLowerCase();
    }
}

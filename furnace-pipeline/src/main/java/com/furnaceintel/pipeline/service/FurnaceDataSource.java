package com.furnaceintel.pipeline.service;

import java.time.LocalDate;

/**
 * Source of raw furnace payloads. Implementations return the payload text or throw
 * {@link FetchException}.
 */
public interface FurnaceDataSource {

    /** Latest readings. */
    String fetchLive();

    /**
     * One half-day of readings.
     *
     * @param range 1 for 00:00-12:00, 2 for 12:00-24:00
     */
    String fetchDaily(LocalDate date, int range);
}

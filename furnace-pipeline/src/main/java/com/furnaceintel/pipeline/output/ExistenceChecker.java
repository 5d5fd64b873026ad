package com.furnaceintel.pipeline.output;

import java.time.Instant;
import java.util.Map;

/**
 * Answers whether the store already holds a point, so non-override runs can skip it.
 */
@FunctionalInterface
public interface ExistenceChecker {

    boolean exists(String measurement, Map<String, String> tags, Instant timestamp);

    /** Treats every point as new. */
    static ExistenceChecker none() {
        return (measurement, tags, timestamp) -> false;
    }
}

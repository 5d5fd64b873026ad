package com.furnaceintel.pipeline.model;

import java.util.Map;

/**
 * One hand-maintained rename table, bound to a single measurement.
 *
 * @param name        table name as it appears in field-mappings.yml, e.g. "TEMP PARAMS MAP"
 * @param measurement measurement every entry of this table is written to
 * @param fields      raw variable name to field identity, in file order
 */
public record MappingTable(String name, String measurement, Map<String, String> fields) {

    public boolean contains(String rawName) {
        return fields.containsKey(rawName);
    }
}

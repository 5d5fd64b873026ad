package com.furnaceintel.pipeline.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.MappingTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the six rename tables from field-mappings.yml.
 *
 * Table order here is lookup priority: when a raw name appears in more than one table the
 * first one listed wins. Overlaps are logged at load time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MappingTablesLoader {

    /** YAML section name to measurement, in priority order. */
    public static final Map<String, String> TABLE_MEASUREMENTS;

    static {
        Map<String, String> tables = new LinkedHashMap<>();
        tables.put("TEMP PARAMS MAP", "temperature_profile");
        tables.put("PROCESS PARAMS MAP", "process_params");
        tables.put("HEATLOAD MAP", "heatload_delta_t");
        tables.put("MISC MAP", "miscellaneous");
        tables.put("COOLING WATER MAP", "cooling_water");
        tables.put("DELTA T MAP", "delta_t");
        TABLE_MEASUREMENTS = Collections.unmodifiableMap(tables);
    }

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ResourceLoader resourceLoader;
    private final FurnacePipelineProperties properties;

    public List<MappingTable> load() {
        String location = properties.getMappings().getLocation();
        Resource resource = resourceLoader.getResource(location);
        log.info("Loading field mappings from {}", location);

        Map<String, LinkedHashMap<String, String>> sections;
        try (InputStream in = resource.getInputStream()) {
            sections = YAML.readValue(in, new TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read field mappings from " + location, e);
        }
        if (sections == null) {
            sections = Map.of();
        }

        List<MappingTable> tables = new ArrayList<>();
        Map<String, String> firstOwner = new HashMap<>();
        for (Map.Entry<String, String> section : TABLE_MEASUREMENTS.entrySet()) {
            Map<String, String> fields = sections.get(section.getKey());
            if (fields == null || fields.isEmpty()) {
                fields = Map.of();
                log.warn("Mapping table '{}' is missing or empty", section.getKey());
            }
            for (String rawName : fields.keySet()) {
                String owner = firstOwner.putIfAbsent(rawName, section.getKey());
                if (owner != null) {
                    log.warn("Variable '{}' is mapped in both '{}' and '{}'; '{}' wins",
                            rawName, owner, section.getKey(), owner);
                }
            }
            tables.add(new MappingTable(section.getKey(), section.getValue(),
                    Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        }

        sections.keySet().stream()
                .filter(name -> !TABLE_MEASUREMENTS.containsKey(name))
                .forEach(name -> log.warn("Ignoring unknown mapping section '{}'", name));

        log.info("Loaded {} mapping tables covering {} variables", tables.size(), firstOwner.size());
        return tables;
    }
}

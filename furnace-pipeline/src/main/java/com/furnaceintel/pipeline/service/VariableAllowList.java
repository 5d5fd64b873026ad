package com.furnaceintel.pipeline.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads a selective-backfill variable list: one raw variable name per line, blank lines ignored.
 */
@Slf4j
public final class VariableAllowList {

    private VariableAllowList() {
    }

    public static Set<String> read(Path file) {
        try {
            Set<String> names = new LinkedHashSet<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String name = line.strip();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
            log.info("Loaded {} variables from {}", names.size(), file);
            return names;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read variable file " + file, e);
        }
    }
}

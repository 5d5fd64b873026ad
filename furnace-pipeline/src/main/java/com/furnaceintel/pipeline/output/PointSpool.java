package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.model.Point;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * Intermediate line-protocol file for one run. The name carries the process id plus a unique
 * suffix, so neither concurrent processes nor concurrent runs in one process collide.
 */
public class PointSpool {

    private final Path path;
    private int lineCount;

    private PointSpool(Path path) {
        this.path = path;
    }

    /**
     * Creates a fresh {@code tmp_<pid>_<unique>.txt} under {@code dir}. Every call gets its own file,
     * so runs overlapping in one process never share a spool.
     */
    public static PointSpool open(Path dir, long pid) {
        try {
            Files.createDirectories(dir);
            return new PointSpool(Files.createTempFile(dir, "tmp_" + pid + "_", ".txt"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create spool file in " + dir, e);
        }
    }

    public void append(Collection<Point> points) {
        if (points.isEmpty()) return;
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.APPEND)) {
            for (Point point : points) {
                writer.write(point.toLineProtocol());
                writer.write('\n');
                lineCount++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to spool file " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    public int lineCount() {
        return lineCount;
    }
}

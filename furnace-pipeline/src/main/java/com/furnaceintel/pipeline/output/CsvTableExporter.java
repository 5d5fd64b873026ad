package com.furnaceintel.pipeline.output;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import com.furnaceintel.pipeline.model.MappingTable;
import com.furnaceintel.pipeline.model.RawRecord;
import com.furnaceintel.pipeline.service.FieldClassifier;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes decoded records to CSV files, one per mapping table.
 *
 * Output path pattern: {outputDir}/{measurement}_{date}.csv
 * e.g. output/temperature_profile_20250529.csv
 *
 * Columns are Timelogged followed by the table's raw variable names, so the files line up
 * with the upstream API rather than with the store's field names.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvTableExporter {

    private final FieldClassifier classifier;
    private final FurnacePipelineProperties properties;

    public List<Path> export(List<RawRecord> records, String dateFile) {
        if (records.isEmpty()) return List.of();

        Path outputDir = Paths.get(properties.getOutput().getDir());
        ensureDirectory(outputDir);

        List<Path> written = new ArrayList<>();
        for (MappingTable table : classifier.tables()) {
            Path outputPath = outputDir.resolve(String.format("%s_%s.csv", table.measurement(), dateFile));
            List<String> variables = new ArrayList<>(table.fields().keySet());

            try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
                 CSVWriter writer = new CSVWriter(out,
                         CSVWriter.DEFAULT_SEPARATOR,
                         CSVWriter.DEFAULT_QUOTE_CHARACTER,
                         CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                         CSVWriter.DEFAULT_LINE_END)) {

                writer.writeNext(header(variables));
                for (RawRecord r : records) {
                    writer.writeNext(toRow(r, variables));
                }
                log.info("Wrote {} records to CSV: {}", records.size(), outputPath);

            } catch (IOException e) {
                log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
                throw new UncheckedIOException("CSV write failed for " + outputPath, e);
            }
            written.add(outputPath);
        }
        return written;
    }

    private String[] header(List<String> variables) {
        String[] header = new String[variables.size() + 1];
        header[0] = RawRecord.TIMESTAMP_FIELD;
        for (int i = 0; i < variables.size(); i++) {
            header[i + 1] = variables.get(i);
        }
        return header;
    }

    private String[] toRow(RawRecord r, List<String> variables) {
        String[] row = new String[variables.size() + 1];
        row[0] = str(r.get(RawRecord.TIMESTAMP_FIELD));
        for (int i = 0; i < variables.size(); i++) {
            row[i + 1] = str(r.get(variables.get(i)));
        }
        return row;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}

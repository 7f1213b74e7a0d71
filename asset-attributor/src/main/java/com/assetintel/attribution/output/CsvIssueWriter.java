package com.assetintel.attribution.output;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.exception.AttributionException;
import com.assetintel.attribution.model.AttributionIssue;
import com.assetintel.attribution.model.AttributionRun;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes the skipped and failed assets of a run to CSV, one line per issue.
 *
 * Output path pattern: {outputDir}/attribution_issues_{runId}.csv
 *
 * Nothing is written for a run without issues.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvIssueWriter {

    private final AttributorProperties properties;

    static final String[] HEADERS = {
            "run_id", "asset_id", "category", "reason", "detail"
    };

    /**
     * @return the file written, or null when the run had no issues
     */
    public Path write(AttributionRun run) {
        if (run.getIssues().isEmpty()) return null;

        Path outputDir = Paths.get(properties.getReport().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(String.format("attribution_issues_%s.csv", run.getRunId()));

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getReport().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (AttributionIssue issue : run.getIssues()) {
                writer.writeNext(toRow(issue));
            }

            log.info("Written {} issues to CSV: {}", run.getIssues().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new AttributionException("CSV write failed", e);
        }
    }

    private String[] toRow(AttributionIssue issue) {
        return new String[]{
                str(issue.getRunId()),
                String.valueOf(issue.getAssetId()),
                str(issue.getCategory()),
                str(issue.getReason()),
                str(issue.getDetail())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new AttributionException("Cannot create output directory: " + dir, e);
        }
    }
}

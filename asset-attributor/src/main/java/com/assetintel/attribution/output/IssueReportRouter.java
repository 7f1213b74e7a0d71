package com.assetintel.attribution.output;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.store.AssetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes the run record and its issue lines to the configured sink(s).
 * Supports STORE, CSV, or BOTH modes.
 *
 * Reporting never changes the outcome of a run, so sink failures are logged
 * and dropped here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IssueReportRouter {

    private final AssetStore store;
    private final CsvIssueWriter csvIssueWriter;
    private final AttributorProperties properties;

    public void write(AttributionRun run) {
        AttributorProperties.Report.ReportMode mode = properties.getReport().getMode();

        switch (mode) {
            case STORE -> writeToStore(run);
            case CSV -> writeToCsv(run);
            case BOTH -> {
                writeToStore(run);
                writeToCsv(run);
            }
        }
    }

    private void writeToStore(AttributionRun run) {
        try {
            store.recordRun(run);
            store.recordIssues(run.getIssues());
        } catch (Exception e) {
            log.warn("Failed to write attribution run {} to the store: {}", run.getRunId(), e.getMessage());
        }
    }

    private void writeToCsv(AttributionRun run) {
        try {
            csvIssueWriter.write(run);
        } catch (Exception e) {
            log.warn("Failed to write issue report for run {}: {}", run.getRunId(), e.getMessage());
        }
    }
}

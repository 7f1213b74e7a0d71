package com.assetintel.attribution.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks each engine run for observability. Stored in the attribution_runs table.
 */
@Data
@Builder
public class AttributionRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private RunStatus status;
    private String errorMessage;    // null on success

    @Builder.Default
    private Map<AssetCategory, CategorySummary> summaries = new EnumMap<>(AssetCategory.class);

    @Builder.Default
    private List<AttributionIssue> issues = new ArrayList<>();

    /** Number of zone or category batches that failed outright */
    private int failedBatches;

    public CategorySummary summaryFor(AssetCategory category) {
        return summaries.computeIfAbsent(category, CategorySummary::new);
    }

    public int totalAttributed() {
        return summaries.values().stream().mapToInt(CategorySummary::getAttributed).sum();
    }

    public enum RunStatus {
        RUNNING, SUCCESS, PARTIAL, FAILED, CANCELLED
    }
}

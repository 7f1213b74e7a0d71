package com.assetintel.attribution.model;

import lombok.Builder;
import lombok.Data;

/**
 * An asset that was skipped or failed during a run. The asset stays eligible
 * and is picked up again by the next run.
 */
@Data
@Builder
public class AttributionIssue {

    private String runId;
    private long assetId;
    private AssetCategory category;
    private IssueReason reason;
    private String detail;
}

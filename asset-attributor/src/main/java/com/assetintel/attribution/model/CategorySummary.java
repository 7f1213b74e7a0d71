package com.assetintel.attribution.model;

import lombok.Data;

/**
 * Per-category counters reported at the end of a run.
 */
@Data
public class CategorySummary {

    private final AssetCategory category;
    private int eligible;
    private int attributed;
    private int pending;
    private int skippedMalformed;
    private int skippedNoZone;
    private int skippedAmbiguous;
    private int failed;

    public void countAttributed() { attributed++; }
    public void countPending() { pending++; }
    public void countMalformed() { skippedMalformed++; }
    public void countNoZone() { skippedNoZone++; }
    public void countAmbiguous() { skippedAmbiguous++; }
    public void countFailed() { failed++; }

    @Override
    public String toString() {
        return String.format("%s: eligible=%d attributed=%d pending=%d skipped-malformed=%d "
                        + "skipped-no-zone=%d skipped-ambiguous=%d failed=%d",
                category, eligible, attributed, pending, skippedMalformed,
                skippedNoZone, skippedAmbiguous, failed);
    }
}

package com.assetintel.attribution.config;

import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.model.CategorySummary;
import com.assetintel.attribution.service.AttributionRuleTable;
import com.assetintel.attribution.service.AttributionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class AttributionController {

    private final AttributionService attributionService;
    private final AttributionRuleTable ruleTable;

    @PostMapping("/attribution/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (attributionService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "rejected", "reason", "attribution run already in progress"));
        }
        new Thread(attributionService::runOnce, "manual-attribution").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/attribution/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "asset-attributor");
        body.put("version", "1.0.0");
        body.put("running", attributionService.isRunning());
        attributionService.currentRun().ifPresent(run -> body.put("currentRun", describe(run)));
        attributionService.lastRun().ifPresent(run -> body.put("lastRun", describe(run)));
        return ResponseEntity.ok(body);
    }

    /**
     * The active decision table, in evaluation order.
     */
    @GetMapping("/attribution/rules")
    public ResponseEntity<Map<String, Object>> rules() {
        return ResponseEntity.ok(Map.of(
                "rules", ruleTable.describe(),
                "defaultStrategy", ruleTable.getDefaultStrategy().name()
        ));
    }

    private Map<String, Object> describe(AttributionRun run) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("runId", run.getRunId());
        view.put("status", run.getStatus().name());
        view.put("startedAt", String.valueOf(run.getStartedAt()));
        view.put("completedAt", String.valueOf(run.getCompletedAt()));
        view.put("attributed", run.totalAttributed());
        view.put("issues", run.getIssues().size());
        view.put("failedBatches", run.getFailedBatches());
        if (run.getErrorMessage() != null) {
            view.put("error", run.getErrorMessage());
        }
        Map<String, String> categories = new LinkedHashMap<>();
        for (CategorySummary summary : run.getSummaries().values()) {
            categories.put(summary.getCategory().name(), summary.toString());
        }
        view.put("categories", categories);
        return view;
    }
}

package com.assetintel.attribution.service;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.exception.AmbiguousZoneException;
import com.assetintel.attribution.exception.MalformedGeometryException;
import com.assetintel.attribution.exception.StoreUnavailableException;
import com.assetintel.attribution.exception.ZoneAllocationConflictException;
import com.assetintel.attribution.exception.ZoneAllocationException;
import com.assetintel.attribution.exception.ZoneNotFoundException;
import com.assetintel.attribution.model.Asset;
import com.assetintel.attribution.model.AssetCategory;
import com.assetintel.attribution.model.AttributionIssue;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.model.AttributionStrategy;
import com.assetintel.attribution.model.CategorySummary;
import com.assetintel.attribution.model.IssueReason;
import com.assetintel.attribution.model.SurveyNode;
import com.assetintel.attribution.model.Zone;
import com.assetintel.attribution.store.AssetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Runs one attribution pass over every configured category.
 *
 * Per category: select eligible assets, derive coordinates and spatial ids,
 * classify, then hand each asset to its naming strategy. Spatial fields are
 * always persisted before a facility id is written. Categories run in the
 * configured order so manholes numbered earlier in the run are visible when
 * mains resolve their endpoints.
 *
 * Per-asset problems become issues on the run and the asset stays eligible.
 * A failed zone batch is counted and its siblings carry on.
 * {@link StoreUnavailableException} ends the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AttributionEngine {

    private final AssetStore store;
    private final AttributorProperties properties;
    private final CoordinateFingerprint fingerprint;
    private final GeometryExtractor geometryExtractor;
    private final AttributionRuleTable ruleTable;
    private final ZoneSequenceAllocator allocator;
    private final EndpointResolver endpointResolver;

    public void run(AttributionRun run) {
        RunContext context = new RunContext();

        for (AssetCategory category : properties.getCategoryOrder()) {
            if (cancelled()) break;
            try {
                processCategory(run, context, category);
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Category {} failed: {}", category, e.getMessage(), e);
                run.setFailedBatches(run.getFailedBatches() + 1);
            }
            log.info("SUMMARY {}", run.summaryFor(category));
        }

        if (cancelled()) {
            log.warn("Run {} cancelled; fields written so far are kept", run.getRunId());
            run.setStatus(AttributionRun.RunStatus.CANCELLED);
        } else if (run.getFailedBatches() > 0) {
            run.setStatus(AttributionRun.RunStatus.PARTIAL);
        } else {
            run.setStatus(AttributionRun.RunStatus.SUCCESS);
        }
    }

    // ── Per category ─────────────────────────────────────────────────────────

    private void processCategory(AttributionRun run, RunContext context, AssetCategory category) {
        CategorySummary summary = run.summaryFor(category);

        List<Asset> candidates = store.findCandidates(category, properties.getAuthoritativeEditor());
        summary.setEligible(candidates.size());
        if (candidates.isEmpty()) {
            stage("PASS", "select", category, 0);
            return;
        }
        stage("FINISH", "select", category, candidates.size());

        List<Asset> derived = deriveAll(run, context, category, candidates);

        Map<AttributionStrategy, List<Asset>> byStrategy = new EnumMap<>(AttributionStrategy.class);
        for (Asset asset : derived) {
            byStrategy.computeIfAbsent(ruleTable.classify(asset), s -> new ArrayList<>()).add(asset);
        }

        List<Asset> fingerprintOnly = byStrategy.getOrDefault(AttributionStrategy.FINGERPRINT_ONLY, List.of());
        List<Asset> zoneSequence = byStrategy.getOrDefault(AttributionStrategy.ZONE_SEQUENCE, List.of());
        List<Asset> endpointPair = byStrategy.getOrDefault(AttributionStrategy.ENDPOINT_PAIR, List.of());
        List<Asset> deferred = byStrategy.getOrDefault(AttributionStrategy.DEFERRED, List.of());

        attributeFromFingerprint(run, category, fingerprintOnly);
        attributeFromZones(run, context, category, zoneSequence);
        attributeFromEndpoints(run, category, endpointPair);

        summary.setPending(summary.getPending() + deferred.size());
        if (!deferred.isEmpty()) {
            log.debug("{} {} assets deferred until they leave the proposed stage", deferred.size(), category);
        }
    }

    private List<Asset> deriveAll(AttributionRun run, RunContext context, AssetCategory category, List<Asset> candidates) {
        stage("START", "derive", category, candidates.size());
        boolean elevationEnabled = properties.getElevation().getCategories().contains(category) && !category.isLine();

        List<Asset> derived = new ArrayList<>(candidates.size());
        int written = 0;
        for (Asset asset : candidates) {
            try {
                boolean changed = geometryExtractor.deriveCoordinates(asset);
                if (elevationEnabled) changed |= deriveElevation(context, asset);
                changed |= deriveSpatialIds(asset);
                if (changed) {
                    store.updateDerivedFields(asset);
                    written++;
                }
                derived.add(asset);
            } catch (MalformedGeometryException e) {
                run.summaryFor(category).countMalformed();
                issue(run, asset, IssueReason.MALFORMED_GEOMETRY, e.getMessage());
            }
        }
        log.debug("{} {} rows received derived fields", written, category);
        stage("FINISH", "derive", category, derived.size());
        return derived;
    }

    private boolean deriveSpatialIds(Asset asset) {
        boolean changed = false;
        if (asset.isLine()) {
            if (asset.getSpatialStart() == null) {
                asset.setSpatialStart(fingerprint.fingerprint(asset.getStartX(), asset.getStartY()));
                changed = true;
            }
            if (asset.getSpatialEnd() == null) {
                asset.setSpatialEnd(fingerprint.fingerprint(asset.getEndX(), asset.getEndY()));
                changed = true;
            }
            if (asset.getSpatialId() == null) {
                asset.setSpatialId(fingerprint.lineFingerprint(asset.getSpatialStart(), asset.getSpatialEnd()));
                changed = true;
            }
        } else if (asset.getSpatialId() == null) {
            asset.setSpatialId(fingerprint.fingerprint(asset.getX(), asset.getY()));
            changed = true;
        }
        return changed;
    }

    private boolean deriveElevation(RunContext context, Asset asset) {
        if (asset.getElevation() != null) return false;

        List<SurveyNode> nodes = context.surveyNodes().findCoincident(
                asset.getX(), asset.getY(), properties.getElevation().getTolerance());
        if (nodes.isEmpty()) return false;
        if (nodes.size() > 1) {
            log.debug("{} {} coincides with {} survey nodes, using node {}",
                    asset.getCategory(), asset.getId(), nodes.size(), nodes.get(0).id());
        }
        asset.setElevation(nodes.get(0).elevation());
        return true;
    }

    // ── Strategies ───────────────────────────────────────────────────────────

    private void attributeFromFingerprint(AttributionRun run, AssetCategory category, List<Asset> assets) {
        if (assets.isEmpty()) {
            stage("PASS", "fingerprint", category, 0);
            return;
        }
        stage("START", "fingerprint", category, assets.size());
        CategorySummary summary = run.summaryFor(category);
        for (Asset asset : assets) {
            try {
                assign(summary, asset, asset.getSpatialId());
            } catch (ZoneAllocationConflictException e) {
                summary.countFailed();
                issue(run, asset, IssueReason.ALLOCATION_FAILED, e.getMessage());
            }
        }
        stage("FINISH", "fingerprint", category, assets.size());
    }

    private void attributeFromZones(AttributionRun run, RunContext context, AssetCategory category, List<Asset> assets) {
        if (assets.isEmpty()) {
            stage("PASS", "zone-sequence", category, 0);
            return;
        }
        stage("START", "zone-sequence", category, assets.size());
        CategorySummary summary = run.summaryFor(category);
        ZoneIndex zones = context.zones();

        // zone code -> members in id order
        Map<String, List<Asset>> byZone = new TreeMap<>();
        for (Asset asset : assets) {
            try {
                Zone zone = zones.locate(asset.getX(), asset.getY());
                byZone.computeIfAbsent(zone.getZoneCode(), z -> new ArrayList<>()).add(asset);
            } catch (ZoneNotFoundException e) {
                summary.countNoZone();
                issue(run, asset, IssueReason.ZONE_NOT_FOUND, e.getMessage());
            } catch (AmbiguousZoneException e) {
                summary.countAmbiguous();
                issue(run, asset, IssueReason.AMBIGUOUS_ZONE, e.getMessage());
            }
        }

        for (Map.Entry<String, List<Asset>> entry : byZone.entrySet()) {
            if (cancelled()) return;
            allocateZone(run, category, entry.getKey(), entry.getValue());
        }
        stage("FINISH", "zone-sequence", category, assets.size());
    }

    private void allocateZone(AttributionRun run, AssetCategory category, String zoneCode, List<Asset> members) {
        CategorySummary summary = run.summaryFor(category);
        int done = 0;
        try {
            String code = allocator.sanitize(zoneCode);
            List<String> existing = store.findFacilityIdsContaining(category, code);
            List<String> ids = allocator.allocate(zoneCode, category, existing, members.size());
            log.debug("Zone {} {}: {} existing ids, allocating {}..{}",
                    zoneCode, category, existing.size(), ids.get(0), ids.get(ids.size() - 1));

            for (Asset asset : members) {
                assign(summary, asset, ids.get(done));
                done++;
            }
        } catch (ZoneAllocationException | IllegalArgumentException e) {
            log.error("Zone {} batch for {} failed after {} of {} assets: {}",
                    zoneCode, category, done, members.size(), e.getMessage());
            run.setFailedBatches(run.getFailedBatches() + 1);
            for (Asset asset : members.subList(done, members.size())) {
                summary.countFailed();
                issue(run, asset, IssueReason.ALLOCATION_FAILED, "zone " + zoneCode + ": " + e.getMessage());
            }
        }
    }

    private void attributeFromEndpoints(AttributionRun run, AssetCategory category, List<Asset> lines) {
        if (lines.isEmpty()) {
            stage("PASS", "endpoint-pair", category, 0);
            return;
        }
        stage("START", "endpoint-pair", category, lines.size());
        CategorySummary summary = run.summaryFor(category);

        // re-read so ids assigned earlier in this run are visible
        PointIndex<Asset> points = new PointIndex<>(
                store.findPoints(properties.getEndpoints().getCategories()), geometryExtractor::locate);
        log.debug("Endpoint index for {}: {} points", category, points.size());

        for (Asset line : lines) {
            EndpointResolver.EndpointPair pair = endpointResolver.resolveEndpoints(line, points);

            if (!Objects.equals(pair.from(), line.getEndpointFrom()) || !Objects.equals(pair.to(), line.getEndpointTo())) {
                store.updateEndpoints(line.getId(), pair.from(), pair.to());
                line.setEndpointFrom(pair.from());
                line.setEndpointTo(pair.to());
            }

            if (!pair.isComplete()) {
                summary.countPending();
                issue(run, line, IssueReason.ENDPOINT_UNRESOLVED, String.format("from=%s to=%s",
                        pair.fromId().orElse("?"), pair.toId().orElse("?")));
                continue;
            }
            try {
                assign(summary, line, pair.facilityId());
            } catch (ZoneAllocationConflictException e) {
                summary.countFailed();
                issue(run, line, IssueReason.ALLOCATION_FAILED, e.getMessage());
            }
        }
        stage("FINISH", "endpoint-pair", category, lines.size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void assign(CategorySummary summary, Asset asset, String facilityId) {
        store.assignFacilityId(asset, facilityId);
        asset.setFacilityId(facilityId);
        summary.countAttributed();
    }

    private void issue(AttributionRun run, Asset asset, IssueReason reason, String detail) {
        log.warn("SKIP {} {} {}: {}", asset.getCategory(), asset.getId(), reason, detail);
        run.getIssues().add(AttributionIssue.builder()
                .runId(run.getRunId())
                .assetId(asset.getId())
                .category(asset.getCategory())
                .reason(reason)
                .detail(detail)
                .build());
    }

    private void stage(String phase, String stage, AssetCategory category, int count) {
        log.info("{} {} category={} count={}", phase, stage, category, count);
    }

    private boolean cancelled() {
        return Thread.currentThread().isInterrupted();
    }

    /**
     * Lookups shared by every category of one run, loaded on first use.
     */
    private class RunContext {

        private ZoneIndex zones;
        private PointIndex<SurveyNode> surveyNodes;

        ZoneIndex zones() {
            if (zones == null) {
                zones = new ZoneIndex(store.findZones());
                log.info("Loaded {} zones", zones.size());
            }
            return zones;
        }

        PointIndex<SurveyNode> surveyNodes() {
            if (surveyNodes == null) {
                surveyNodes = new PointIndex<>(store.findSurveyNodes(), node -> node.location().getCoordinate());
                log.info("Loaded {} survey nodes", surveyNodes.size());
            }
            return surveyNodes;
        }
    }
}

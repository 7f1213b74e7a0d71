package com.assetintel.attribution.service;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.exception.StoreUnavailableException;
import com.assetintel.attribution.model.Asset;
import com.assetintel.attribution.model.AssetCategory;
import com.assetintel.attribution.model.AttributionIssue;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.model.AttributionStrategy;
import com.assetintel.attribution.model.CategorySummary;
import com.assetintel.attribution.model.IssueReason;
import com.assetintel.attribution.model.Ownership;
import com.assetintel.attribution.model.Stage;
import com.assetintel.attribution.model.SurveyNode;
import com.assetintel.attribution.model.WaterType;
import com.assetintel.attribution.store.InMemoryAssetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.assetintel.attribution.TestGeometries.line;
import static com.assetintel.attribution.TestGeometries.operatorMain;
import static com.assetintel.attribution.TestGeometries.operatorPoint;
import static com.assetintel.attribution.TestGeometries.point;
import static com.assetintel.attribution.TestGeometries.zone;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class AttributionEngineTest {

    private final CoordinateFingerprint fingerprint = new CoordinateFingerprint();

    private InMemoryAssetStore store;
    private AttributionEngine engine;

    @BeforeEach
    void setUp() {
        AttributorProperties properties = new AttributorProperties();
        properties.getSequence().getCategorySuffixes().put(AssetCategory.CLEANOUT, "C");
        properties.getElevation().getCategories().add(AssetCategory.INLET);

        store = new InMemoryAssetStore()
                .addZone(zone(1, "14-14", 0, 0, 1000, 1000))
                .addZone(zone(2, "14-15", 1000, 0, 2000, 1000))
                .addZone(zone(3, "20-01", 5000, 0, 6000, 1000))
                .addZone(zone(4, "20-02", 5500, 0, 6500, 1000))
                .add(operatorPoint(1, AssetCategory.MANHOLE, 50, 50).facilityId("1414065").build())
                .add(operatorPoint(2, AssetCategory.MANHOLE, 60, 60).facilityId("1414070").build())
                .add(operatorPoint(101, AssetCategory.MANHOLE, 100, 100).build())
                .add(operatorPoint(102, AssetCategory.MANHOLE, 200, 100).build())
                .add(operatorPoint(103, AssetCategory.MANHOLE, 300, 100).build())
                .add(operatorMain(201, 100, 100, 200, 100).build());

        engine = new AttributionEngine(store, properties, fingerprint, new GeometryExtractor(),
                new AttributionRuleTable(AttributionRuleTable.standardRules(), AttributionStrategy.FINGERPRINT_ONLY),
                new ZoneSequenceAllocator(properties), new EndpointResolver(properties));
    }

    @Test
    void numbersNewManholesAfterTheHighestIdInTheirZone() {
        AttributionRun run = runEngine();

        assertThat(run.getStatus()).isEqualTo(AttributionRun.RunStatus.SUCCESS);
        assertThat(store.row(101).getFacilityId()).isEqualTo("1414071");
        assertThat(store.row(102).getFacilityId()).isEqualTo("1414072");
        assertThat(store.row(103).getFacilityId()).isEqualTo("1414073");
        assertThat(store.row(101).getSpatialId()).isEqualTo(fingerprint.fingerprint(100.0, 100.0));
        assertThat(store.row(101).getX()).isEqualTo(100.0);
        assertThat(run.summaryFor(AssetCategory.MANHOLE).getAttributed()).isEqualTo(3);
    }

    @Test
    void mainsPickUpManholeIdsAssignedEarlierInTheSameRun() {
        runEngine();

        Asset main = store.row(201);
        assertThat(main.getEndpointFrom()).isEqualTo("1414071");
        assertThat(main.getEndpointTo()).isEqualTo("1414072");
        assertThat(main.getFacilityId()).isEqualTo("1414071-1414072");
        assertThat(main.getSpatialId()).isEqualTo(
                fingerprint.fingerprint(100.0, 100.0) + "_" + fingerprint.fingerprint(200.0, 100.0));
    }

    @Test
    void spatialFieldsAreWrittenBeforeTheFacilityId() {
        runEngine();

        assertThat(store.writesFor(101)).containsExactly("derived:101", "assign:101");
        assertThat(store.writesFor(201)).containsExactly("derived:201", "endpoints:201", "assign:201");
    }

    @Test
    void assetsThatAlreadyHaveAFacilityIdAreNeverTouched() {
        runEngine();

        assertThat(store.writesFor(1)).isEmpty();
        assertThat(store.writesFor(2)).isEmpty();
        assertThat(store.row(1).getSpatialId()).isNull();
        assertThat(store.row(2).getFacilityId()).isEqualTo("1414070");
    }

    @Test
    void secondRunChangesNothing() {
        runEngine();
        int writes = store.operations.size();

        AttributionRun second = runEngine();

        assertThat(second.getStatus()).isEqualTo(AttributionRun.RunStatus.SUCCESS);
        assertThat(second.totalAttributed()).isZero();
        assertThat(store.operations).hasSize(writes);
        assertThat(store.row(103).getFacilityId()).isEqualTo("1414073");
    }

    @Test
    void leavesRecordsOfTheAuthoritativeEditorAlone() {
        store.add(operatorPoint(105, AssetCategory.MANHOLE, 400, 100).lastEditor("COSPW").build());

        AttributionRun run = runEngine();

        assertThat(store.writesFor(105)).isEmpty();
        assertThat(store.row(105).getFacilityId()).isNull();
        assertThat(run.summaryFor(AssetCategory.MANHOLE).getEligible()).isEqualTo(3);
    }

    @Test
    void skipsMalformedGeometryAndCarriesOn() {
        store.add(operatorPoint(106, AssetCategory.MANHOLE, 0, 0).shape(null).build());

        AttributionRun run = runEngine();

        assertThat(run.getStatus()).isEqualTo(AttributionRun.RunStatus.SUCCESS);
        assertThat(run.summaryFor(AssetCategory.MANHOLE).getSkippedMalformed()).isEqualTo(1);
        assertThat(run.getIssues()).extracting(AttributionIssue::getAssetId, AttributionIssue::getReason)
                .containsExactly(tuple(106L, IssueReason.MALFORMED_GEOMETRY));
        assertThat(store.writesFor(106)).isEmpty();
        assertThat(store.row(103).getFacilityId()).isEqualTo("1414073");
    }

    @Test
    void pointOutsideEveryZoneKeepsItsSpatialIdButNoFacilityId() {
        store.add(operatorPoint(107, AssetCategory.MANHOLE, 3000, 3000).build());

        AttributionRun run = runEngine();

        assertThat(run.summaryFor(AssetCategory.MANHOLE).getSkippedNoZone()).isEqualTo(1);
        assertThat(store.row(107).getSpatialId()).isEqualTo(fingerprint.fingerprint(3000.0, 3000.0));
        assertThat(store.row(107).getFacilityId()).isNull();
        assertThat(run.getIssues()).extracting(AttributionIssue::getReason).containsExactly(IssueReason.ZONE_NOT_FOUND);
    }

    @Test
    void pointInOverlappingZonesIsReportedAsAmbiguous() {
        store.add(operatorPoint(108, AssetCategory.MANHOLE, 5700, 500).build());

        AttributionRun run = runEngine();

        assertThat(run.summaryFor(AssetCategory.MANHOLE).getSkippedAmbiguous()).isEqualTo(1);
        assertThat(store.row(108).getFacilityId()).isNull();
        assertThat(run.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getReason()).isEqualTo(IssueReason.AMBIGUOUS_ZONE);
            assertThat(issue.getDetail()).contains("20-01", "20-02");
        });
    }

    @Test
    void conflictAbortsOnlyTheAffectedZoneAndTheNextRunRecovers() {
        store.add(operatorPoint(301, AssetCategory.MANHOLE, 1500, 100).build());
        store.rejectFacilityId("1414072");

        AttributionRun first = runEngine();

        assertThat(first.getStatus()).isEqualTo(AttributionRun.RunStatus.PARTIAL);
        assertThat(first.getFailedBatches()).isEqualTo(1);
        CategorySummary manholes = first.summaryFor(AssetCategory.MANHOLE);
        assertThat(manholes.getAttributed()).isEqualTo(2);
        assertThat(manholes.getFailed()).isEqualTo(2);
        assertThat(store.row(101).getFacilityId()).isEqualTo("1414071");
        assertThat(store.row(102).getFacilityId()).isNull();
        assertThat(store.row(103).getFacilityId()).isNull();
        assertThat(store.row(301).getFacilityId()).isEqualTo("1415001");
        assertThat(store.row(201).getFacilityId()).isNull();

        AttributionRun second = runEngine();

        assertThat(second.getStatus()).isEqualTo(AttributionRun.RunStatus.SUCCESS);
        assertThat(store.row(102).getFacilityId()).isEqualTo("1414072");
        assertThat(store.row(103).getFacilityId()).isEqualTo("1414073");
        assertThat(store.row(201).getFacilityId()).isEqualTo("1414071-1414072");
    }

    @Test
    void oneSidedMainStaysPendingUntilItsOtherManholeIsNumbered() {
        store.add(operatorMain(202, 300, 100, 400, 100).build());

        AttributionRun first = runEngine();

        assertThat(first.summaryFor(AssetCategory.GRAVITY_MAIN).getPending()).isEqualTo(1);
        assertThat(store.row(202).getEndpointFrom()).isEqualTo("1414073");
        assertThat(store.row(202).getEndpointTo()).isNull();
        assertThat(store.row(202).getFacilityId()).isNull();
        assertThat(first.getIssues()).extracting(AttributionIssue::getReason)
                .containsExactly(IssueReason.ENDPOINT_UNRESOLVED);

        store.add(operatorPoint(104, AssetCategory.MANHOLE, 400, 100).facilityId("1414090").build());
        runEngine();

        assertThat(store.row(202).getEndpointFrom()).isEqualTo("1414073");
        assertThat(store.row(202).getFacilityId()).isEqualTo("1414073-1414090");
    }

    @Test
    void privateAssetsUseTheirSpatialIdAsFacilityId() {
        store.add(Asset.builder()
                .id(401)
                .category(AssetCategory.CLEANOUT)
                .shape(point(123456.7, 987654.3))
                .ownership(Ownership.PRIVATE)
                .stage(Stage.AS_BUILT)
                .build());

        runEngine();

        assertThat(store.row(401).getSpatialId()).isEqualTo("3476-55-5654");
        assertThat(store.row(401).getFacilityId()).isEqualTo("3476-55-5654");
    }

    @Test
    void stormCulvertsAndPrivateMainsUseTheirLineSpatialId() {
        store.add(Asset.builder()
                .id(601)
                .category(AssetCategory.CULVERT)
                .shape(line(100, 100, 200, 100))
                .ownership(Ownership.PRIMARY_OPERATOR)
                .waterType(WaterType.STORM)
                .stage(Stage.AS_BUILT)
                .build());
        store.add(Asset.builder()
                .id(602)
                .category(AssetCategory.GRAVITY_MAIN)
                .shape(line(123456.7, 987654.3, 124500.2, 988712.9))
                .ownership(Ownership.PRIVATE)
                .waterType(WaterType.SANITARY)
                .stage(Stage.AS_BUILT)
                .build());

        AttributionRun run = runEngine();

        assertThat(run.getStatus()).isEqualTo(AttributionRun.RunStatus.SUCCESS);
        Asset culvert = store.row(601);
        assertThat(culvert.getFacilityId()).isEqualTo(culvert.getSpatialStart() + "_" + culvert.getSpatialEnd());
        assertThat(culvert.getSpatialStart()).isEqualTo(fingerprint.fingerprint(100.0, 100.0));
        assertThat(culvert.getEndpointFrom()).isNull();
        assertThat(culvert.getEndpointTo()).isNull();
        assertThat(store.writesFor(601)).containsExactly("derived:601", "assign:601");

        Asset privateMain = store.row(602);
        assertThat(privateMain.getFacilityId()).isEqualTo("3476-55-5654_4587-01-0012");
        assertThat(privateMain.getFacilityId()).isEqualTo(privateMain.getSpatialId());
        assertThat(privateMain.getEndpointFrom()).isNull();
        assertThat(privateMain.getEndpointTo()).isNull();
        assertThat(store.writesFor(602)).containsExactly("derived:602", "assign:602");
    }

    @Test
    void newZoneIgnoresNumbersOfAZoneWhoseCodeContainsIt() {
        store.addZone(zone(5, "4-14", 2000, 0, 2900, 1000));
        store.add(operatorPoint(110, AssetCategory.MANHOLE, 2100, 100).build());

        runEngine();

        assertThat(store.row(110).getFacilityId()).isEqualTo("414001");
        assertThat(store.row(103).getFacilityId()).isEqualTo("1414073");
    }

    @Test
    void operatorCleanoutsCountSeparatelyWithTheirSuffix() {
        store.add(operatorPoint(402, AssetCategory.CLEANOUT, 150, 150).build());

        runEngine();

        assertThat(store.row(402).getFacilityId()).isEqualTo("1414001C");
    }

    @Test
    void proposedAssetsGetSpatialFieldsOnly() {
        store.add(operatorPoint(109, AssetCategory.MANHOLE, 500, 500).stage(Stage.PROPOSED).build());

        AttributionRun run = runEngine();

        assertThat(store.row(109).getSpatialId()).isNotNull();
        assertThat(store.row(109).getFacilityId()).isNull();
        assertThat(run.summaryFor(AssetCategory.MANHOLE).getPending()).isEqualTo(1);
        assertThat(run.getStatus()).isEqualTo(AttributionRun.RunStatus.SUCCESS);
    }

    @Test
    void copiesElevationFromCoincidentSurveyNode() {
        store.addSurveyNode(new SurveyNode(9, point(700, 700), 12.5));
        store.add(operatorPoint(501, AssetCategory.INLET, 700, 700).build());
        store.add(operatorPoint(502, AssetCategory.INLET, 800, 800).build());

        runEngine();

        assertThat(store.row(501).getElevation()).isEqualTo(12.5);
        assertThat(store.row(502).getElevation()).isNull();
        assertThat(store.row(501).getFacilityId()).isEqualTo("1414001");
    }

    @Test
    void interruptedRunStopsBeforeTouchingTheStore() {
        Thread.currentThread().interrupt();
        try {
            AttributionRun run = runEngine();

            assertThat(run.getStatus()).isEqualTo(AttributionRun.RunStatus.CANCELLED);
            assertThat(store.operations).isEmpty();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void unavailableStoreEndsTheRun() {
        store.setUnavailable(true);

        assertThatThrownBy(this::runEngine).isInstanceOf(StoreUnavailableException.class);
    }

    private AttributionRun runEngine() {
        AttributionRun run = AttributionRun.builder()
                .runId("test-run")
                .startedAt(LocalDateTime.now())
                .status(AttributionRun.RunStatus.RUNNING)
                .build();
        engine.run(run);
        return run;
    }
}

package com.assetintel.attribution.store;

import com.assetintel.attribution.exception.StoreUnavailableException;
import com.assetintel.attribution.exception.ZoneAllocationConflictException;
import com.assetintel.attribution.model.Asset;
import com.assetintel.attribution.model.AssetCategory;
import com.assetintel.attribution.model.AttributionIssue;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.model.CategorySummary;
import com.assetintel.attribution.model.Ownership;
import com.assetintel.attribution.model.Stage;
import com.assetintel.attribution.model.SurveyNode;
import com.assetintel.attribution.model.WaterType;
import com.assetintel.attribution.model.Zone;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Relational asset store. Geometry is held as WKT; every spatial predicate the
 * engine needs is evaluated in memory with JTS, so any JDBC database will do.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcAssetStore implements AssetStore {

    private static final String ASSET_COLUMNS = """
            id, category, shape_wkt, ownership, water_type, stage, last_editor,
            nad83_x, nad83_y, nad83_x_start, nad83_y_start, nad83_x_end, nad83_y_end, elevation,
            spatial_start, spatial_end, spatial_id, facility_id, endpoint_from, endpoint_to
            """;

    private final JdbcTemplate jdbcTemplate;
    private final GeometryFactory geometryFactory = new GeometryFactory();

    @Override
    public void ensureSchema() {
        log.info("Ensuring asset store schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS network_assets
            (
                id              BIGINT PRIMARY KEY,
                category        VARCHAR(32) NOT NULL,
                shape_wkt       VARCHAR,
                ownership       INTEGER,
                water_type      VARCHAR(2),
                stage           INTEGER,
                last_editor     VARCHAR(50),
                nad83_x         DOUBLE PRECISION,
                nad83_y         DOUBLE PRECISION,
                nad83_x_start   DOUBLE PRECISION,
                nad83_y_start   DOUBLE PRECISION,
                nad83_x_end     DOUBLE PRECISION,
                nad83_y_end     DOUBLE PRECISION,
                elevation       DOUBLE PRECISION,
                spatial_start   VARCHAR(20),
                spatial_end     VARCHAR(20),
                spatial_id      VARCHAR(41),
                facility_id     VARCHAR(41),
                endpoint_from   VARCHAR(20),
                endpoint_to     VARCHAR(20)
            )
        """);

        jdbcTemplate.execute("""
            CREATE UNIQUE INDEX IF NOT EXISTS ux_network_assets_facility_id
            ON network_assets (category, facility_id)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS map_zones
            (
                id              BIGINT PRIMARY KEY,
                zone_code       VARCHAR(20) NOT NULL,
                boundary_wkt    VARCHAR
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS survey_nodes
            (
                id              BIGINT PRIMARY KEY,
                nad83_x         DOUBLE PRECISION NOT NULL,
                nad83_y         DOUBLE PRECISION NOT NULL,
                navd88_z        DOUBLE PRECISION NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS attribution_runs
            (
                run_id          VARCHAR(36) NOT NULL,
                started_at      TIMESTAMP NOT NULL,
                completed_at    TIMESTAMP,
                status          VARCHAR(16) NOT NULL,
                eligible        INTEGER,
                attributed      INTEGER,
                pending         INTEGER,
                skipped         INTEGER,
                failed          INTEGER,
                failed_batches  INTEGER,
                error_message   VARCHAR
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS attribution_issues
            (
                run_id          VARCHAR(36) NOT NULL,
                asset_id        BIGINT NOT NULL,
                category        VARCHAR(32) NOT NULL,
                reason          VARCHAR(32) NOT NULL,
                detail          VARCHAR
            )
        """);

        log.info("Asset store schema ready.");
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    @Override
    @Retry(name = "assetStore")
    public List<Asset> findCandidates(AssetCategory category, String authoritativeEditor) {
        String sql = "SELECT " + ASSET_COLUMNS + """
            FROM network_assets
            WHERE category = ?
              AND facility_id IS NULL
              AND (last_editor IS NULL OR last_editor <> ?)
            ORDER BY id
            """;
        return read("candidates for " + category,
                () -> jdbcTemplate.query(sql, this::mapAsset, category.name(), authoritativeEditor));
    }

    @Override
    @Retry(name = "assetStore")
    public List<Asset> findPoints(Set<AssetCategory> categories) {
        if (categories.isEmpty()) return Collections.emptyList();

        String placeholders = categories.stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT " + ASSET_COLUMNS + " FROM network_assets WHERE category IN (" + placeholders + ") ORDER BY id";
        Object[] args = categories.stream().map(AssetCategory::name).toArray();
        return read("points " + categories, () -> jdbcTemplate.query(sql, this::mapAsset, args));
    }

    @Override
    @Retry(name = "assetStore")
    public List<Zone> findZones() {
        String sql = "SELECT id, zone_code, boundary_wkt FROM map_zones ORDER BY zone_code, id";
        return read("zones", () -> jdbcTemplate.query(sql, (rs, rowNum) -> Zone.builder()
                .id(rs.getLong("id"))
                .zoneCode(rs.getString("zone_code"))
                .boundary(parseWkt(rs.getString("boundary_wkt"), "zone " + rs.getLong("id")))
                .build()));
    }

    @Override
    @Retry(name = "assetStore")
    public List<String> findFacilityIdsContaining(AssetCategory category, String fragment) {
        String sql = """
            SELECT facility_id
            FROM network_assets
            WHERE category = ?
              AND facility_id LIKE ?
            """;
        return read("facility ids like " + fragment,
                () -> jdbcTemplate.queryForList(sql, String.class, category.name(), "%" + fragment + "%"));
    }

    @Override
    @Retry(name = "assetStore")
    public List<SurveyNode> findSurveyNodes() {
        String sql = "SELECT id, nad83_x, nad83_y, navd88_z FROM survey_nodes ORDER BY id";
        return read("survey nodes", () -> jdbcTemplate.query(sql, (rs, rowNum) -> new SurveyNode(
                rs.getLong("id"),
                geometryFactory.createPoint(new Coordinate(rs.getDouble("nad83_x"), rs.getDouble("nad83_y"))),
                rs.getDouble("navd88_z"))));
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    @Override
    public void updateDerivedFields(Asset asset) {
        String sql = """
            UPDATE network_assets SET
                nad83_x       = COALESCE(nad83_x, ?),
                nad83_y       = COALESCE(nad83_y, ?),
                nad83_x_start = COALESCE(nad83_x_start, ?),
                nad83_y_start = COALESCE(nad83_y_start, ?),
                nad83_x_end   = COALESCE(nad83_x_end, ?),
                nad83_y_end   = COALESCE(nad83_y_end, ?),
                elevation     = COALESCE(elevation, ?),
                spatial_start = COALESCE(spatial_start, ?),
                spatial_end   = COALESCE(spatial_end, ?),
                spatial_id    = COALESCE(spatial_id, ?)
            WHERE id = ?
            """;
        Object[] args = {
                asset.getX(), asset.getY(),
                asset.getStartX(), asset.getStartY(), asset.getEndX(), asset.getEndY(),
                asset.getElevation(),
                asset.getSpatialStart(), asset.getSpatialEnd(), asset.getSpatialId(),
                asset.getId()
        };
        int[] types = {
                Types.DOUBLE, Types.DOUBLE,
                Types.DOUBLE, Types.DOUBLE, Types.DOUBLE, Types.DOUBLE,
                Types.DOUBLE,
                Types.VARCHAR, Types.VARCHAR, Types.VARCHAR,
                Types.BIGINT
        };
        write("derived fields of asset " + asset.getId(), () -> jdbcTemplate.update(sql, args, types));
    }

    @Override
    public void updateEndpoints(long assetId, String endpointFrom, String endpointTo) {
        String sql = """
            UPDATE network_assets SET
                endpoint_from = COALESCE(endpoint_from, ?),
                endpoint_to   = COALESCE(endpoint_to, ?)
            WHERE id = ?
            """;
        write("endpoints of asset " + assetId, () -> jdbcTemplate.update(sql,
                new Object[]{endpointFrom, endpointTo, assetId},
                new int[]{Types.VARCHAR, Types.VARCHAR, Types.BIGINT}));
    }

    @Override
    public void assignFacilityId(Asset asset, String facilityId) {
        String sql = """
            UPDATE network_assets
            SET facility_id = ?
            WHERE id = ?
              AND facility_id IS NULL
              AND spatial_id IS NOT NULL
            """;
        int updated;
        try {
            updated = write("facility id of asset " + asset.getId(),
                    () -> jdbcTemplate.update(sql, facilityId, asset.getId()));
        } catch (DuplicateKeyException e) {
            throw new ZoneAllocationConflictException(facilityId, String.format(
                    "Facility id %s already exists for %s (asset %d)", facilityId, asset.getCategory(), asset.getId()), e);
        }
        if (updated == 0) {
            throw new ZoneAllocationConflictException(facilityId, String.format(
                    "Asset %d was attributed by another writer or has no spatial id; %s not written",
                    asset.getId(), facilityId));
        }
    }

    @Override
    public void recordRun(AttributionRun run) {
        int eligible = 0, attributed = 0, pending = 0, skipped = 0, failed = 0;
        for (CategorySummary summary : run.getSummaries().values()) {
            eligible += summary.getEligible();
            attributed += summary.getAttributed();
            pending += summary.getPending();
            skipped += summary.getSkippedMalformed() + summary.getSkippedNoZone() + summary.getSkippedAmbiguous();
            failed += summary.getFailed();
        }

        jdbcTemplate.update("""
                INSERT INTO attribution_runs
                (run_id, started_at, completed_at, status, eligible, attributed, pending,
                 skipped, failed, failed_batches, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                new Object[]{
                        run.getRunId(),
                        Timestamp.valueOf(run.getStartedAt()),
                        run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                        run.getStatus().name(),
                        eligible, attributed, pending, skipped, failed,
                        run.getFailedBatches(),
                        run.getErrorMessage()
                },
                new int[]{
                        Types.VARCHAR, Types.TIMESTAMP, Types.TIMESTAMP, Types.VARCHAR,
                        Types.INTEGER, Types.INTEGER, Types.INTEGER, Types.INTEGER, Types.INTEGER,
                        Types.INTEGER, Types.VARCHAR
                });
    }

    @Override
    public void recordIssues(List<AttributionIssue> issues) {
        if (issues.isEmpty()) return;

        List<Object[]> rows = issues.stream()
                .map(issue -> new Object[]{
                        issue.getRunId(),
                        issue.getAssetId(),
                        issue.getCategory().name(),
                        issue.getReason().name(),
                        issue.getDetail() != null ? issue.getDetail() : ""
                })
                .toList();
        jdbcTemplate.batchUpdate("""
                INSERT INTO attribution_issues (run_id, asset_id, category, reason, detail)
                VALUES (?, ?, ?, ?, ?)
                """, rows);
        log.debug("Recorded {} attribution issues", rows.size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new StoreUnavailableException("Asset store unavailable while reading " + what, e);
        }
    }

    private int write(String what, Supplier<Integer> update) {
        try {
            return update.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new StoreUnavailableException("Asset store unavailable while writing " + what, e);
        }
    }

    private Asset mapAsset(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        return Asset.builder()
                .id(id)
                .category(AssetCategory.valueOf(rs.getString("category")))
                .shape(parseWkt(rs.getString("shape_wkt"), "asset " + id))
                .ownership(Ownership.fromCode(nullableInt(rs, "ownership")))
                .waterType(WaterType.fromCode(rs.getString("water_type")))
                .stage(Stage.fromCode(nullableInt(rs, "stage")))
                .lastEditor(rs.getString("last_editor"))
                .x(nullableDouble(rs, "nad83_x"))
                .y(nullableDouble(rs, "nad83_y"))
                .startX(nullableDouble(rs, "nad83_x_start"))
                .startY(nullableDouble(rs, "nad83_y_start"))
                .endX(nullableDouble(rs, "nad83_x_end"))
                .endY(nullableDouble(rs, "nad83_y_end"))
                .elevation(nullableDouble(rs, "elevation"))
                .spatialStart(rs.getString("spatial_start"))
                .spatialEnd(rs.getString("spatial_end"))
                .spatialId(rs.getString("spatial_id"))
                .facilityId(rs.getString("facility_id"))
                .endpointFrom(rs.getString("endpoint_from"))
                .endpointTo(rs.getString("endpoint_to"))
                .build();
    }

    /** Unparseable WKT becomes a null shape, reported later as malformed geometry. */
    private Geometry parseWkt(String wkt, String owner) {
        if (wkt == null || wkt.isBlank()) return null;
        try {
            return new WKTReader(geometryFactory).read(wkt);
        } catch (ParseException e) {
            log.warn("Unreadable geometry on {}: {}", owner, e.getMessage());
            return null;
        }
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}

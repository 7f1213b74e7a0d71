package com.assetintel.attribution.model;

import lombok.Builder;
import lombok.Data;
import org.locationtech.jts.geom.Geometry;

/**
 * One network record as read from the asset store.
 *
 * Field notes:
 *  - shape is the raw geometry; x/y and start/end coordinates are derived from it
 *  - spatialId and facilityId are written once and never recomputed
 *  - endpointFrom/endpointTo only apply to line assets (FROMMH / TOMH)
 */
@Data
@Builder(toBuilder = true)
public class Asset {

    // ── Identity ────────────────────────────────────────────────────────────
    private long id;
    private AssetCategory category;

    // ── Geometry ────────────────────────────────────────────────────────────
    private Geometry shape;

    /** Point coordinates (NAD83X / NAD83Y) */
    private Double x;
    private Double y;

    /** Line vertex coordinates (NAD83XSTART ... NAD83YEND) */
    private Double startX;
    private Double startY;
    private Double endX;
    private Double endY;

    /** Elevation copied from a coincident survey node, when known */
    private Double elevation;

    // ── Classification ──────────────────────────────────────────────────────
    private Ownership ownership;
    private WaterType waterType;
    private Stage stage;
    private String lastEditor;

    // ── Derived identifiers ─────────────────────────────────────────────────
    private String spatialStart;
    private String spatialEnd;
    private String spatialId;
    private String facilityId;
    private String endpointFrom;
    private String endpointTo;

    public boolean isLine() {
        return category.isLine();
    }

    public boolean hasDerivedCoordinates() {
        return isLine()
                ? startX != null && startY != null && endX != null && endY != null
                : x != null && y != null;
    }
}

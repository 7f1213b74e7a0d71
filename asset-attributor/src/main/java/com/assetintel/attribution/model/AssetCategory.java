package com.assetintel.attribution.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Network asset classes handled by the attributor.
 *
 * Detention basins are stored as polygons but are identified by their
 * centroid, so they attribute like any other point asset.
 */
@Getter
@RequiredArgsConstructor
public enum AssetCategory {

    MANHOLE(GeometryKind.POINT),
    CLEANOUT(GeometryKind.POINT),
    INLET(GeometryKind.POINT),
    FITTING(GeometryKind.POINT),
    DISCHARGE_POINT(GeometryKind.POINT),
    DETENTION_BASIN(GeometryKind.POINT),
    GRAVITY_MAIN(GeometryKind.LINE),
    CULVERT(GeometryKind.LINE);

    private final GeometryKind geometryKind;

    public boolean isLine() {
        return geometryKind == GeometryKind.LINE;
    }
}

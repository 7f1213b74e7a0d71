package com.assetintel.attribution.model;

import lombok.Builder;
import lombok.Data;
import org.locationtech.jts.geom.Geometry;

/**
 * Map-grid cell used to scope facility id numbering, e.g. quarter section "14-14".
 */
@Data
@Builder
public class Zone {

    private long id;
    private String zoneCode;    // raw SEWMAP code, may contain separators
    private Geometry boundary;
}

package com.assetintel.attribution.exception;

import lombok.Getter;

import java.util.List;

/**
 * The point lies inside more than one zone polygon. Overlapping zones are a
 * data defect and are never resolved by picking one of them.
 */
@Getter
public class AmbiguousZoneException extends AttributionException {

    private final List<String> zoneCodes;

    public AmbiguousZoneException(double x, double y, List<String> zoneCodes) {
        super(String.format("Point (%.3f, %.3f) lies in %d zones: %s", x, y, zoneCodes.size(), zoneCodes));
        this.zoneCodes = List.copyOf(zoneCodes);
    }
}

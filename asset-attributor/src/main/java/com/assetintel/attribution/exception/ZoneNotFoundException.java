package com.assetintel.attribution.exception;

public class ZoneNotFoundException extends AttributionException {

    public ZoneNotFoundException(double x, double y) {
        super(String.format("No zone contains point (%.3f, %.3f)", x, y));
    }
}

package com.assetintel.attribution.exception;

public class ZoneSequenceExhaustedException extends ZoneAllocationException {

    public ZoneSequenceExhaustedException(String zoneCode, int width) {
        super(String.format("Zone %s has no free %d-digit sequence numbers left", zoneCode, width));
    }
}

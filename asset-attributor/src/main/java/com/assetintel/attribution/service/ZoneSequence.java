package com.assetintel.attribution.service;

import com.assetintel.attribution.exception.ZoneSequenceExhaustedException;

/**
 * Allocation state for one (zone, category) pair: the sanitized zone code and
 * the last sequence number handed out. Immutable; {@link #advance()} returns
 * the next state.
 */
public record ZoneSequence(String zoneCode, String suffix, int width, int lastNumber) {

    public ZoneSequence {
        if (width < 1 || width > 9) {
            throw new IllegalArgumentException("Sequence width must be between 1 and 9, got " + width);
        }
        suffix = suffix == null ? "" : suffix;
    }

    public int maxNumber() {
        return (int) Math.pow(10, width) - 1;
    }

    public ZoneSequence advance() {
        if (lastNumber >= maxNumber()) {
            throw new ZoneSequenceExhaustedException(zoneCode, width);
        }
        return new ZoneSequence(zoneCode, suffix, width, lastNumber + 1);
    }

    /** Facility id for {@link #lastNumber()}, e.g. 1414 + 071 + "" */
    public String currentId() {
        return zoneCode + String.format("%0" + width + "d", lastNumber) + suffix;
    }
}

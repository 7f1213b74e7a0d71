package com.assetintel.attribution.service;

import com.assetintel.attribution.exception.MalformedGeometryException;
import org.springframework.stereotype.Component;

/**
 * Builds the spatial id token from a projected coordinate pair.
 *
 * Both coordinates are truncated toward zero and read as digit strings X and Y:
 *
 *   X[2..4) + Y[2..4) + "-" + X[4] + Y[4] + "-" + X[last two] + Y[last two]
 *
 * e.g. (123456.7, 987654.3) → "3476-55-5654"
 *
 * Digits are read from the magnitude, so a negative coordinate gives the
 * same token as its absolute value. Integer parts shorter than five digits
 * are left padded with zeros so the fixed offsets always exist.
 */
@Component
public class CoordinateFingerprint {

    static final int MIN_DIGITS = 5;
    private static final double MAX_MAGNITUDE = 1.0e15;

    public String fingerprint(Double x, Double y) {
        String xs = digits(x, "x");
        String ys = digits(y, "y");

        return xs.substring(2, 4) + ys.substring(2, 4)
                + "-" + xs.charAt(4) + ys.charAt(4)
                + "-" + xs.substring(xs.length() - 2) + ys.substring(ys.length() - 2);
    }

    public String lineFingerprint(String startToken, String endToken) {
        if (startToken == null || endToken == null) {
            throw new MalformedGeometryException("Line fingerprint needs both endpoint tokens");
        }
        return startToken + "_" + endToken;
    }

    private String digits(Double value, String axis) {
        if (value == null) {
            throw new MalformedGeometryException("Missing " + axis + " coordinate");
        }
        if (!Double.isFinite(value) || Math.abs(value) >= MAX_MAGNITUDE) {
            throw new MalformedGeometryException("Unusable " + axis + " coordinate: " + value);
        }
        String raw = Long.toString(Math.abs((long) value.doubleValue()));
        if (raw.length() >= MIN_DIGITS) return raw;
        return "0".repeat(MIN_DIGITS - raw.length()) + raw;
    }
}

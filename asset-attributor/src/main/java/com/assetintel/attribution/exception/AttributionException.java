package com.assetintel.attribution.exception;

/**
 * Base type for every failure raised while attributing assets.
 */
public class AttributionException extends RuntimeException {

    public AttributionException(String message) {
        super(message);
    }

    public AttributionException(String message, Throwable cause) {
        super(message, cause);
    }
}

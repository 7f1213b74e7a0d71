package com.assetintel.attribution.exception;

/**
 * Missing, empty or non-finite geometry. The asset is skipped for this run.
 */
public class MalformedGeometryException extends AttributionException {

    public MalformedGeometryException(String message) {
        super(message);
    }
}

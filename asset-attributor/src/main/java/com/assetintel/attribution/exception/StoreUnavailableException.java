package com.assetintel.attribution.exception;

/**
 * Connectivity or infrastructure failure talking to the asset store. Fatal to the run.
 */
public class StoreUnavailableException extends AttributionException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

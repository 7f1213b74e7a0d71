package com.assetintel.attribution.exception;

/**
 * Allocation failure scoped to one zone batch. Sibling zones keep going.
 */
public class ZoneAllocationException extends AttributionException {

    public ZoneAllocationException(String message) {
        super(message);
    }

    public ZoneAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}

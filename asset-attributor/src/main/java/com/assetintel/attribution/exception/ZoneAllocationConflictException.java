package com.assetintel.attribution.exception;

import lombok.Getter;

/**
 * The store refused a facility id because it already exists or the target row
 * was attributed underneath us. Either way another writer is active.
 */
@Getter
public class ZoneAllocationConflictException extends ZoneAllocationException {

    private final String facilityId;

    public ZoneAllocationConflictException(String facilityId, String message, Throwable cause) {
        super(message, cause);
        this.facilityId = facilityId;
    }

    public ZoneAllocationConflictException(String facilityId, String message) {
        super(message);
        this.facilityId = facilityId;
    }
}

package com.assetintel.attribution.model;

/**
 * How an asset's facility id is produced.
 */
public enum AttributionStrategy {

    /** Facility id is the spatial id. */
    FINGERPRINT_ONLY,

    /** Zone code plus the next free three digit sequence number. */
    ZONE_SEQUENCE,

    /** {@code FROMMH-TOMH} built from the coincident endpoint manholes. */
    ENDPOINT_PAIR,

    /** Spatial fields only; the facility id is left for a later run. */
    DEFERRED
}

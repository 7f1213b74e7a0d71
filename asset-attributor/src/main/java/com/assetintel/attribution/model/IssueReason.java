package com.assetintel.attribution.model;

public enum IssueReason {
    MALFORMED_GEOMETRY,
    ZONE_NOT_FOUND,
    AMBIGUOUS_ZONE,
    ALLOCATION_FAILED,
    ENDPOINT_UNRESOLVED
}

package com.assetintel.attribution.model;

public enum GeometryKind {
    POINT, LINE
}

package com.assetintel.attribution.model;

import org.locationtech.jts.geom.Point;

/**
 * GPS survey point with a measured elevation (NAVD88).
 */
public record SurveyNode(long id, Point location, double elevation) {}

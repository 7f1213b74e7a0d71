package com.assetintel.attribution.service;

import com.assetintel.attribution.exception.MalformedGeometryException;
import com.assetintel.attribution.model.Asset;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.springframework.stereotype.Component;

/**
 * Vertex extraction: point location, line start/end vertex, polygon centroid.
 * Replaces the POINT_X / LINE_START_X style geometry attribute calculations.
 */
@Component
@Slf4j
public class GeometryExtractor {

    /**
     * Fill in whichever derived coordinate fields are still null.
     *
     * @return true if any field was written
     */
    public boolean deriveCoordinates(Asset asset) {
        if (asset.hasDerivedCoordinates()) {
            requireFinite(asset);
            return false;
        }

        if (asset.isLine()) {
            Coordinate[] vertices = lineVertices(asset);
            Coordinate start = vertices[0];
            Coordinate end = vertices[vertices.length - 1];
            if (asset.getStartX() == null) asset.setStartX(start.getX());
            if (asset.getStartY() == null) asset.setStartY(start.getY());
            if (asset.getEndX() == null) asset.setEndX(end.getX());
            if (asset.getEndY() == null) asset.setEndY(end.getY());
        } else {
            Coordinate location = pointLocation(asset);
            if (asset.getX() == null) asset.setX(location.getX());
            if (asset.getY() == null) asset.setY(location.getY());
        }
        requireFinite(asset);
        return true;
    }

    /**
     * Location used for coincidence and containment tests, or null when the
     * asset has no usable point geometry.
     */
    public Coordinate locate(Asset asset) {
        if (asset.isLine()) return null;
        if (asset.getX() != null && asset.getY() != null) {
            return new Coordinate(asset.getX(), asset.getY());
        }
        try {
            return pointLocation(asset);
        } catch (MalformedGeometryException e) {
            log.debug("Asset {} has no usable location: {}", asset.getId(), e.getMessage());
            return null;
        }
    }

    private Coordinate pointLocation(Asset asset) {
        Geometry shape = requireShape(asset);
        Point point = switch (shape.getDimension()) {
            case 0 -> shape.getNumPoints() == 1 ? (Point) shape.getGeometryN(0) : null;
            case 2 -> shape.getCentroid();
            default -> null;
        };
        if (point == null || point.isEmpty()) {
            throw new MalformedGeometryException(String.format(
                    "%s %d has a %s shape where a point or polygon is expected",
                    asset.getCategory(), asset.getId(), shape.getGeometryType()));
        }
        return point.getCoordinate();
    }

    private Coordinate[] lineVertices(Asset asset) {
        Geometry shape = requireShape(asset);
        Coordinate[] vertices = shape.getCoordinates();
        if (shape.getDimension() != 1 || vertices.length < 2) {
            throw new MalformedGeometryException(String.format(
                    "%s %d has a %s shape where a line is expected",
                    asset.getCategory(), asset.getId(), shape.getGeometryType()));
        }
        return vertices;
    }

    private Geometry requireShape(Asset asset) {
        Geometry shape = asset.getShape();
        if (shape == null || shape.isEmpty()) {
            throw new MalformedGeometryException(asset.getCategory() + " " + asset.getId() + " has no geometry");
        }
        return shape;
    }

    private void requireFinite(Asset asset) {
        Double[] values = asset.isLine()
                ? new Double[]{asset.getStartX(), asset.getStartY(), asset.getEndX(), asset.getEndY()}
                : new Double[]{asset.getX(), asset.getY()};
        for (Double value : values) {
            if (value == null || !Double.isFinite(value)) {
                throw new MalformedGeometryException(String.format(
                        "%s %d has a non-finite coordinate", asset.getCategory(), asset.getId()));
            }
        }
    }
}

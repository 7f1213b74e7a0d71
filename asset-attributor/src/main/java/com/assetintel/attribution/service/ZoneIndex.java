package com.assetintel.attribution.service;

import com.assetintel.attribution.exception.AmbiguousZoneException;
import com.assetintel.attribution.exception.ZoneNotFoundException;
import com.assetintel.attribution.model.Zone;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Point-in-zone lookup over the map-grid polygons, loaded once per run.
 *
 * A point must lie strictly inside exactly one zone (COMPLETELY_WITHIN).
 */
public class ZoneIndex {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final STRtree tree = new STRtree();
    private final int size;

    public ZoneIndex(Collection<Zone> zones) {
        int count = 0;
        for (Zone zone : zones) {
            if (zone.getBoundary() == null || zone.getBoundary().isEmpty()) continue;
            tree.insert(zone.getBoundary().getEnvelopeInternal(), zone);
            count++;
        }
        tree.build();
        this.size = count;
    }

    public int size() {
        return size;
    }

    public Zone locate(double x, double y) {
        Point point = geometryFactory.createPoint(new Coordinate(x, y));

        @SuppressWarnings("unchecked")
        List<Zone> candidates = tree.query(point.getEnvelopeInternal());

        List<Zone> containing = candidates.stream()
                .filter(zone -> zone.getBoundary().contains(point))
                .sorted(Comparator.comparing(Zone::getZoneCode).thenComparingLong(Zone::getId))
                .toList();

        if (containing.isEmpty()) {
            throw new ZoneNotFoundException(x, y);
        }
        if (containing.size() > 1) {
            throw new AmbiguousZoneException(x, y, containing.stream().map(Zone::getZoneCode).toList());
        }
        return containing.get(0);
    }
}

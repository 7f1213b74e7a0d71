package com.assetintel.attribution.service;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Coincidence lookup over a population of located items (manholes, survey nodes).
 * Items whose locator returns null are left out.
 */
public class PointIndex<T> {

    private final STRtree tree = new STRtree();
    private final int size;

    public PointIndex(Collection<T> items, Function<T, Coordinate> locator) {
        int count = 0;
        for (T item : items) {
            Coordinate location = locator.apply(item);
            if (location == null) continue;
            tree.insert(new Envelope(location), new Entry<>(item, location, count));
            count++;
        }
        tree.build();
        this.size = count;
    }

    public int size() {
        return size;
    }

    /**
     * Items within {@code tolerance} of (x, y), in insertion order.
     */
    public List<T> findCoincident(double x, double y, double tolerance) {
        Coordinate target = new Coordinate(x, y);
        Envelope search = new Envelope(target);
        search.expandBy(tolerance);

        @SuppressWarnings("unchecked")
        List<Entry<T>> hits = tree.query(search);

        List<Entry<T>> matches = new ArrayList<>();
        for (Entry<T> hit : hits) {
            if (hit.location().distance(target) <= tolerance) {
                matches.add(hit);
            }
        }
        matches.sort((a, b) -> Integer.compare(a.order(), b.order()));
        return matches.stream().map(Entry::item).toList();
    }

    private record Entry<T>(T item, Coordinate location, int order) {}
}

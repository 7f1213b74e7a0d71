package com.assetintel.attribution.service;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.model.Asset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the manholes a main starts and ends on (FROMMH / TOMH).
 *
 * Each still-null side is looked up independently; a side that already has a
 * value is returned unchanged. When several points sit on the same vertex the
 * lexicographically smallest facility id wins and a warning is logged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EndpointResolver {

    private final AttributorProperties properties;

    public EndpointPair resolveEndpoints(Asset line, PointIndex<Asset> points) {
        if (!line.isLine()) {
            throw new IllegalArgumentException(line.getCategory() + " " + line.getId() + " is not a line asset");
        }
        String from = line.getEndpointFrom() != null
                ? line.getEndpointFrom()
                : resolve(line, "start", line.getStartX(), line.getStartY(), points);
        String to = line.getEndpointTo() != null
                ? line.getEndpointTo()
                : resolve(line, "end", line.getEndX(), line.getEndY(), points);
        return new EndpointPair(from, to);
    }

    private String resolve(Asset line, String side, Double x, Double y, PointIndex<Asset> points) {
        if (x == null || y == null) return null;

        List<Asset> candidates = points.findCoincident(x, y, properties.getEndpoints().getTolerance());
        if (candidates.isEmpty()) {
            log.debug("{} {} {} vertex: no coincident point", line.getCategory(), line.getId(), side);
            return null;
        }
        if (candidates.size() == 1) {
            return candidates.get(0).getFacilityId();
        }

        Optional<String> smallest = candidates.stream()
                .map(Asset::getFacilityId)
                .filter(Objects::nonNull)
                .sorted()
                .findFirst();
        log.warn("{} {} {} vertex coincides with {} points (ids {}); using {}",
                line.getCategory(), line.getId(), side, candidates.size(),
                candidates.stream().map(Asset::getId).toList(), smallest.orElse("none"));
        return smallest.orElse(null);
    }

    /**
     * Resolved FROMMH / TOMH labels; either side may still be missing.
     */
    public record EndpointPair(String from, String to) {

        public Optional<String> fromId() {
            return Optional.ofNullable(from);
        }

        public Optional<String> toId() {
            return Optional.ofNullable(to);
        }

        public boolean isComplete() {
            return from != null && to != null;
        }

        public String facilityId() {
            if (!isComplete()) {
                throw new IllegalStateException("Endpoint pair is incomplete: " + from + " / " + to);
            }
            return from + "-" + to;
        }
    }
}

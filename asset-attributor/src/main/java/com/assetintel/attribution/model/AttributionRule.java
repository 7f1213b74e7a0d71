package com.assetintel.attribution.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row of the attribution decision table. Empty sets and a null geometry
 * kind are wildcards.
 */
public record AttributionRule(
        String name,
        Set<AssetCategory> categories,
        GeometryKind geometry,
        Set<Ownership> ownerships,
        Set<WaterType> waterTypes,
        Set<Stage> stages,
        AttributionStrategy strategy
) {

    public AttributionRule {
        if (strategy == null) {
            throw new IllegalArgumentException("Rule '" + name + "' has no strategy");
        }
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        ownerships = ownerships == null ? Set.of() : Set.copyOf(ownerships);
        waterTypes = waterTypes == null ? Set.of() : Set.copyOf(waterTypes);
        stages = stages == null ? Set.of() : Set.copyOf(stages);
    }

    public boolean matches(Asset asset) {
        return accepts(categories, asset.getCategory())
                && (geometry == null || geometry == asset.getCategory().getGeometryKind())
                && accepts(ownerships, asset.getOwnership())
                && accepts(waterTypes, asset.getWaterType())
                && accepts(stages, asset.getStage());
    }

    public Map<String, Object> describe() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("categories", categories);
        row.put("geometry", geometry == null ? "ANY" : geometry);
        row.put("ownerships", ownerships);
        row.put("waterTypes", waterTypes);
        row.put("stages", stages);
        row.put("strategy", strategy);
        return row;
    }

    private static <E> boolean accepts(Set<E> allowed, E value) {
        return allowed.isEmpty() || allowed.contains(value);
    }
}

package com.assetintel.attribution.service;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.model.Asset;
import com.assetintel.attribution.model.AttributionRule;
import com.assetintel.attribution.model.AttributionStrategy;
import com.assetintel.attribution.model.GeometryKind;
import com.assetintel.attribution.model.Ownership;
import com.assetintel.attribution.model.Stage;
import com.assetintel.attribution.model.WaterType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes each asset to a naming strategy using the configured decision table
 * (attributor.rules). Rules are evaluated in order and the first match wins.
 */
@Component
@Slf4j
public class AttributionRuleTable {

    @Getter
    private final List<AttributionRule> rules;
    @Getter
    private final AttributionStrategy defaultStrategy;

    @Autowired
    public AttributionRuleTable(AttributorProperties properties) {
        this(properties.getRules().isEmpty()
                        ? standardRules()
                        : properties.getRules().stream().map(AttributionRuleTable::toRule).toList(),
                properties.getDefaultStrategy());
        log.info("Attribution rule table loaded: {} rules, default {}", rules.size(), defaultStrategy);
    }

    public AttributionRuleTable(List<AttributionRule> rules, AttributionStrategy defaultStrategy) {
        this.rules = List.copyOf(rules);
        this.defaultStrategy = defaultStrategy == null ? AttributionStrategy.FINGERPRINT_ONLY : defaultStrategy;
    }

    public AttributionStrategy classify(Asset asset) {
        for (AttributionRule rule : rules) {
            if (rule.matches(asset)) {
                log.trace("{} {} matched rule '{}' -> {}", asset.getCategory(), asset.getId(), rule.name(), rule.strategy());
                return rule.strategy();
            }
        }
        return defaultStrategy;
    }

    public List<Map<String, Object>> describe() {
        return rules.stream().map(AttributionRule::describe).toList();
    }

    /**
     * Table used when attributor.rules is not configured.
     */
    public static List<AttributionRule> standardRules() {
        return List.of(
                new AttributionRule("operator-points", Set.of(), GeometryKind.POINT,
                        Set.of(Ownership.PRIMARY_OPERATOR), Set.of(), Set.of(Stage.AS_BUILT),
                        AttributionStrategy.ZONE_SEQUENCE),
                new AttributionRule("non-operator-points", Set.of(), GeometryKind.POINT,
                        Set.of(Ownership.PRIVATE, Ownership.OTHER), Set.of(), Set.of(),
                        AttributionStrategy.FINGERPRINT_ONLY),
                new AttributionRule("storm-on-sanitary-network", Set.of(), null,
                        Set.of(), Set.of(WaterType.STORM), Set.of(),
                        AttributionStrategy.FINGERPRINT_ONLY),
                new AttributionRule("operator-sewer-lines", Set.of(), GeometryKind.LINE,
                        Set.of(Ownership.PRIMARY_OPERATOR), Set.of(WaterType.SANITARY, WaterType.COMBINED),
                        Set.of(Stage.AS_BUILT), AttributionStrategy.ENDPOINT_PAIR),
                new AttributionRule("proposed", Set.of(), null,
                        Set.of(), Set.of(), Set.of(Stage.PROPOSED),
                        AttributionStrategy.DEFERRED),
                new AttributionRule("other-lines", Set.of(), GeometryKind.LINE,
                        Set.of(), Set.of(), Set.of(),
                        AttributionStrategy.FINGERPRINT_ONLY));
    }

    private static AttributionRule toRule(AttributorProperties.Rule rule) {
        return new AttributionRule(rule.getName(), rule.getCategories(), rule.getGeometry(),
                rule.getOwnerships(), rule.getWaterTypes(), rule.getStages(), rule.getStrategy());
    }
}

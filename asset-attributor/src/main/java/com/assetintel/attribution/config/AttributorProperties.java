package com.assetintel.attribution.config;

import com.assetintel.attribution.model.AssetCategory;
import com.assetintel.attribution.model.AttributionStrategy;
import com.assetintel.attribution.model.GeometryKind;
import com.assetintel.attribution.model.Ownership;
import com.assetintel.attribution.model.Stage;
import com.assetintel.attribution.model.WaterType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "attributor")
@Data
public class AttributorProperties {

    /**
     * Records last edited by this account are left alone (LASTEDITOR &lt;&gt; marker).
     */
    private String authoritativeEditor = "COSPW";

    /**
     * Processing order. Point categories must come before the line categories
     * that resolve their endpoints against them.
     */
    private List<AssetCategory> categoryOrder = new ArrayList<>(List.of(
            AssetCategory.MANHOLE,
            AssetCategory.CLEANOUT,
            AssetCategory.INLET,
            AssetCategory.FITTING,
            AssetCategory.DISCHARGE_POINT,
            AssetCategory.DETENTION_BASIN,
            AssetCategory.GRAVITY_MAIN,
            AssetCategory.CULVERT));

    /** Strategy used when no rule matches */
    private AttributionStrategy defaultStrategy = AttributionStrategy.FINGERPRINT_ONLY;

    /** Decision table, first match wins. Empty means the built-in standard table. */
    private List<Rule> rules = new ArrayList<>();

    private Sequence sequence = new Sequence();
    private Endpoints endpoints = new Endpoints();
    private Elevation elevation = new Elevation();
    private Report report = new Report();
    private Scheduling scheduling = new Scheduling();

    /**
     * One row of the decision table. An empty set or null value matches anything.
     */
    @Data
    public static class Rule {
        private String name;
        private Set<AssetCategory> categories = new LinkedHashSet<>();
        private GeometryKind geometry;
        private Set<Ownership> ownerships = new LinkedHashSet<>();
        private Set<WaterType> waterTypes = new LinkedHashSet<>();
        private Set<Stage> stages = new LinkedHashSet<>();
        private AttributionStrategy strategy;
    }

    @Data
    public static class Sequence {
        /** Characters stripped from zone codes before formatting, "14-14" -> "1414" */
        private String separators = "- ";
        private int width = 3;
        /** Trailing letter per category, e.g. CLEANOUT: C gives 1414007C */
        private Map<AssetCategory, String> categorySuffixes = new LinkedHashMap<>();
    }

    @Data
    public static class Endpoints {
        /** Point categories a main may start or end on */
        private Set<AssetCategory> categories = new LinkedHashSet<>(Set.of(AssetCategory.MANHOLE));
        /** Coincidence tolerance in store coordinate units */
        private double tolerance = 0.001;
    }

    @Data
    public static class Elevation {
        /** Categories whose elevation is copied from coincident survey nodes; empty disables the stage */
        private Set<AssetCategory> categories = new LinkedHashSet<>();
        private double tolerance = 0.001;
    }

    @Data
    public static class Report {
        private ReportMode mode = ReportMode.STORE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/attribution";
            private boolean includeHeader = true;
        }

        public enum ReportMode {
            STORE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
        /** Run once at startup and exit with the run's status code */
        private boolean exitAfterStartupRun = false;
    }
}

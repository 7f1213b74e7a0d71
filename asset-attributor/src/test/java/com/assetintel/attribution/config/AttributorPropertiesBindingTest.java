package com.assetintel.attribution.config;

import com.assetintel.attribution.model.AssetCategory;
import com.assetintel.attribution.model.AttributionStrategy;
import com.assetintel.attribution.model.GeometryKind;
import com.assetintel.attribution.model.Ownership;
import com.assetintel.attribution.service.AttributionRuleTable;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AttributorPropertiesBindingTest {

    @Test
    void shippedConfigurationBindsCompletely() throws IOException {
        AttributorProperties properties = bind("application.yml");

        assertThat(properties.getAuthoritativeEditor()).isEqualTo("COSPW");
        assertThat(properties.getCategoryOrder()).startsWith(AssetCategory.MANHOLE).endsWith(AssetCategory.CULVERT);
        assertThat(properties.getSequence().getWidth()).isEqualTo(3);
        assertThat(properties.getSequence().getCategorySuffixes()).containsEntry(AssetCategory.CLEANOUT, "C");
        assertThat(properties.getEndpoints().getCategories()).containsExactly(AssetCategory.MANHOLE);
        assertThat(properties.getElevation().getCategories())
                .containsExactlyInAnyOrder(AssetCategory.INLET, AssetCategory.DISCHARGE_POINT);
        assertThat(properties.getReport().getMode()).isEqualTo(AttributorProperties.Report.ReportMode.STORE);
        assertThat(properties.getScheduling().isRunOnStartup()).isFalse();

        AttributorProperties.Rule first = properties.getRules().get(0);
        assertThat(first.getGeometry()).isEqualTo(GeometryKind.POINT);
        assertThat(first.getOwnerships()).containsExactly(Ownership.PRIMARY_OPERATOR);
        assertThat(first.getStrategy()).isEqualTo(AttributionStrategy.ZONE_SEQUENCE);
    }

    @Test
    void shippedRulesMatchTheBuiltInTable() throws IOException {
        AttributionRuleTable table = new AttributionRuleTable(bind("application.yml"));

        assertThat(table.getRules()).isEqualTo(AttributionRuleTable.standardRules());
    }

    @Test
    void oneshotProfileExitsAfterTheStartupRun() throws IOException {
        AttributorProperties properties = bind("application.yml", "application-oneshot.yml");

        assertThat(properties.getScheduling().isExitAfterStartupRun()).isTrue();
    }

    private AttributorProperties bind(String... resources) throws IOException {
        StandardEnvironment environment = new StandardEnvironment();
        YamlPropertySourceLoader loader = new YamlPropertySourceLoader();
        for (String resource : resources) {
            List<PropertySource<?>> sources = loader.load(resource, new ClassPathResource(resource));
            // later files win
            sources.forEach(source -> environment.getPropertySources().addFirst(source));
        }
        return Binder.get(environment).bind("attributor", AttributorProperties.class).get();
    }
}

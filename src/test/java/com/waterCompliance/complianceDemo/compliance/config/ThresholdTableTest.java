package com.waterCompliance.complianceDemo.compliance.config;

import com.waterCompliance.complianceDemo.compliance.model.HealthSignificanceBand;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.PercentileMethod;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.StatisticMethod;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdEntry;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThresholdTableTest {

    private final ThresholdTable table = new ThresholdTable(
            "thresholds/threshold-table.json", "thresholds/health-significance.json");

    @Test
    void shouldLoadBundledTableInFileOrder() {
        assertThat(table.getEntries())
                .extracting(ThresholdEntry::getParameter)
                .startsWith("E. coli", "Nitrate", "Lead", "Copper");
    }

    @Test
    void shouldFindEntriesByNameOrAliasIgnoringCaseAndPunctuation() {
        assertThat(table.find("e.coli")).map(ThresholdEntry::getParameter).contains("E. coli");
        assertThat(table.find("Escherichia coli")).map(ThresholdEntry::getParameter).contains("E. coli");
        assertThat(table.find("tthm")).map(ThresholdEntry::getParameter).contains("Total Trihalomethanes");
        assertThat(table.find("Uranium")).isEmpty();
    }

    @Test
    void shouldApplyDefaultsForOmittedAttributes() {
        ThresholdEntry lead = table.find("Lead").orElseThrow();

        assertThat(lead.getKind()).isEqualTo(ThresholdKind.ACTION_LEVEL);
        assertThat(lead.getTier()).isEqualTo(NotificationTier.TIER_2);
        assertThat(lead.getPercentile()).isEqualTo(0.9);
        assertThat(lead.getPercentileMethod()).isEqualTo(PercentileMethod.NEAREST_RANK);
        assertThat(lead.getMonitoringSeverity()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void shouldPickHighestHealthBandReached() {
        ThresholdTable custom = new ThresholdTable(
                List.of(entry("Lead", List.of())),
                List.of(band("Lead", 1.5, RiskLevel.HIGH), band("Lead", 2.0, RiskLevel.CRITICAL)));

        assertThat(custom.healthSeverity("Lead", 1.2)).isEmpty();
        assertThat(custom.healthSeverity("lead", 1.7)).contains(RiskLevel.HIGH);
        assertThat(custom.healthSeverity("Lead", 2.0)).contains(RiskLevel.CRITICAL);
    }

    @Test
    void shouldRejectAliasSharedByTwoParameters() {
        assertThatThrownBy(() -> new ThresholdTable(
                List.of(entry("Lead", List.of("Pb")), entry("Plumbum", List.of("PB"))), List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate threshold key");
    }

    @Test
    void shouldRejectEntryWithoutStatistic() {
        ThresholdEntry incomplete = ThresholdEntry.builder().parameter("Lead").unit("ppb").tier(NotificationTier.TIER_2).build();

        assertThatThrownBy(() -> new ThresholdTable(List.of(incomplete), List.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    private static ThresholdEntry entry(String parameter, List<String> aliases) {
        return ThresholdEntry.builder()
                .parameter(parameter)
                .aliases(aliases)
                .threshold(15)
                .unit("ppb")
                .statistic(StatisticMethod.MAXIMUM)
                .tier(NotificationTier.TIER_2)
                .build();
    }

    private static HealthSignificanceBand band(String parameter, double minRatio, RiskLevel severity) {
        return HealthSignificanceBand.builder().parameter(parameter).minRatio(minRatio).severity(severity).build();
    }
}

package com.waterCompliance.complianceDemo.registry.client;

import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.external.StubClientHttpRequestFactory;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.registry.model.RecordedViolation;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import com.waterCompliance.complianceDemo.registry.repository.SystemCatalogRepository;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class EpaSystemLookupClientTest {

    private static final String BASE_URL = "https://data.epa.gov/efservice";

    private final SystemCatalogRepository catalog = new SystemCatalogRepository("data/systems.json");

    @Test
    void shouldMapWaterSystemRowAndMergeCatalogAttributes() {
        StubClientHttpRequestFactory factory = new StubClientHttpRequestFactory("""
                [{"pwsid":"OH7700001","pws_name":"CLINTON MACHINE PWS ","population_served_count":"76",
                  "pws_type_code":"NTNCWS","pws_activity_code":"A","city_name":"CLINTON","state_code":"OH"}]
                """);
        EpaSystemLookupClient client = new EpaSystemLookupClient(factory, BASE_URL, catalog);

        Optional<WaterSystemInfo> found = client.lookup("OH7700001");

        assertThat(found).isPresent();
        WaterSystemInfo system = found.get();
        assertThat(system.getName()).isEqualTo("CLINTON MACHINE PWS");
        assertThat(system.getPopulationServed()).isEqualTo(76L);
        assertThat(system.getSystemType()).isEqualTo("NTNCWS");
        assertThat(system.getDataSource()).isEqualTo("sdwis");
        assertThat(system.getNonEnglishSpeakingFraction()).isEqualTo(0.04);
        assertThat(system.getRecordedViolations()).isEmpty();
        assertThat(factory.getRequestedUris()).extracting(URI::getPath).containsExactly(
                "/efservice/sdwis.water_system/pwsid/equals/OH7700001/json",
                "/efservice/sdwis.violation/pwsid/equals/OH7700001/json");
    }

    @Test
    void shouldAttachRecordedViolationHistory() {
        StubClientHttpRequestFactory factory = new StubClientHttpRequestFactory("""
                [{"pwsid":"OH7700001","pws_name":"CLINTON MACHINE PWS","population_served_count":76}]
                """).route("sdwis.violation", """
                [{"pwsid":"OH7700001","violation_code":"57","contaminant_code":"PB90","compl_per_begin_date":"2024-01-01"},
                 {"pwsid":"OH7700001","violation_code":"22","contaminant_code":"3100","compl_per_begin_date":"2023-07-01"},
                 {"pwsid":"OH7700001","violation_code":"03","contaminant_code":"9999"}]
                """);
        EpaSystemLookupClient client = new EpaSystemLookupClient(factory, BASE_URL, catalog);

        List<RecordedViolation> history = client.lookup("OH7700001").orElseThrow().getRecordedViolations();

        assertThat(history).extracting(RecordedViolation::getParameter, RecordedViolation::getTier, RecordedViolation::getSeverity)
                .containsExactly(
                        tuple("Lead", NotificationTier.TIER_2, RiskLevel.CRITICAL),
                        tuple("Total Coliform", NotificationTier.TIER_1, RiskLevel.CRITICAL),
                        tuple("Contaminant 9999", NotificationTier.TIER_2, RiskLevel.HIGH));
        assertThat(history.get(0).getViolationCode()).isEqualTo("57");
        assertThat(history.get(0).getCompliancePeriodBegin()).isEqualTo("2024-01-01");
    }

    @Test
    void shouldKeepSystemRecordWhenViolationHistoryFails() {
        StubClientHttpRequestFactory factory = new StubClientHttpRequestFactory("""
                [{"pwsid":"OH7700001","pws_name":"CLINTON MACHINE PWS"}]
                """).route("sdwis.violation", "not json");
        EpaSystemLookupClient client = new EpaSystemLookupClient(factory, BASE_URL, catalog);

        WaterSystemInfo system = client.lookup("OH7700001").orElseThrow();

        assertThat(system.getName()).isEqualTo("CLINTON MACHINE PWS");
        assertThat(system.getRecordedViolations()).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenRegistryHasNoRow() {
        EpaSystemLookupClient client = new EpaSystemLookupClient(new StubClientHttpRequestFactory("[]"), BASE_URL, catalog);

        assertThat(client.lookup("ZZ0000000")).isEmpty();
    }

    @Test
    void shouldWrapRegistryErrorsAsExternalCallFailures() {
        EpaSystemLookupClient client = new EpaSystemLookupClient(
                new StubClientHttpRequestFactory("{}", HttpStatus.SERVICE_UNAVAILABLE), BASE_URL, catalog);

        assertThatThrownBy(() -> client.lookup("OH7700001"))
                .isInstanceOf(ExternalCallException.class)
                .hasMessageContaining("OH7700001");
    }
}

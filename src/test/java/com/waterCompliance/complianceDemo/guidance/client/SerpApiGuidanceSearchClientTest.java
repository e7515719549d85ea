package com.waterCompliance.complianceDemo.guidance.client;

import com.waterCompliance.complianceDemo.external.StubClientHttpRequestFactory;
import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerpApiGuidanceSearchClientTest {

    private static final String RESULTS = """
            {"organic_results": [
              {"title": "Lead Service Line Replacement", "link": "https://www.epa.gov/ground-water-and-drinking-water/lead-service-lines", "snippet": "Guidance"},
              {"title": "Some blog", "link": "https://example.com/lead", "snippet": "Not official"},
              {"title": "Corrosion Control Treatment", "link": "https://www.epa.gov/dwreginfo/optimal-corrosion-control-treatment", "snippet": "OCCT"}
            ]}
            """;

    @Test
    void shouldKeepOnlyEpaResultsWithoutDuplicates() {
        StubClientHttpRequestFactory factory = new StubClientHttpRequestFactory(RESULTS);
        SerpApiGuidanceSearchClient client = client(factory, 10);

        List<GuidanceReference> references = client.search("Lead", "action level exceedance");

        assertThat(references).extracting(GuidanceReference::getTitle)
                .containsExactly("Lead Service Line Replacement", "Corrosion Control Treatment");
        assertThat(references).allMatch(reference -> "epa.gov".equals(reference.getSource()));
        assertThat(factory.getRequestedUris()).hasSize(3);
        assertThat(factory.getRequestedUris().get(0).getQuery()).contains("engine=google").contains("api_key=test-key");
    }

    @Test
    void shouldCapResultsAtConfiguredMaximum() {
        SerpApiGuidanceSearchClient client = client(new StubClientHttpRequestFactory(RESULTS), 1);

        assertThat(client.search("Lead", "action level exceedance")).hasSize(1);
    }

    @Test
    void shouldRefuseToSearchWithoutApiKey() {
        SerpApiGuidanceSearchClient client = new SerpApiGuidanceSearchClient(new StubClientHttpRequestFactory(RESULTS));

        assertThatThrownBy(() -> client.search("Lead", "action level exceedance"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("guidance.serpapi.key");
    }

    private static SerpApiGuidanceSearchClient client(StubClientHttpRequestFactory factory, int maxResults) {
        SerpApiGuidanceSearchClient client = new SerpApiGuidanceSearchClient(factory);
        ReflectionTestUtils.setField(client, "apiKey", "test-key");
        ReflectionTestUtils.setField(client, "maxResults", maxResults);
        return client;
    }
}

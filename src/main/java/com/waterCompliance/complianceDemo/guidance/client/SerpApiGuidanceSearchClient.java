package com.waterCompliance.complianceDemo.guidance.client;

import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallTimeoutException;
import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web search through SerpApi's Google engine, keeping only results hosted on epa.gov.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "guidance.provider", havingValue = "serpapi")
public class SerpApiGuidanceSearchClient implements GuidanceSearchClient {

    private static final String SERPAPI_URL = "https://serpapi.com";
    private static final String TRUSTED_DOMAIN = "epa.gov";

    private final RestClient restClient;

    @Value("${guidance.serpapi.key:}")
    private String apiKey;

    @Value("${guidance.max-results:10}")
    private int maxResults;

    public SerpApiGuidanceSearchClient(@Qualifier("externalRequestFactory") ClientHttpRequestFactory requestFactory) {
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .baseUrl(SERPAPI_URL)
                .build();
    }

    @Override
    public List<GuidanceReference> search(String contaminant, String violationType) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("SerpApi key is not configured. Set guidance.serpapi.key in application.yaml");
        }
        List<String> queries = List.of(
                "EPA " + contaminant + " drinking water treatment technology guidance",
                "EPA " + contaminant + " remediation best practices",
                "EPA drinking water " + violationType + " corrective action"
        );

        // keyed by link to drop duplicates across queries
        Map<String, GuidanceReference> references = new LinkedHashMap<>();
        for (String query : queries) {
            for (Map<String, Object> result : organicResults(query)) {
                String link = String.valueOf(result.getOrDefault("link", ""));
                if (link.contains(TRUSTED_DOMAIN)) {
                    references.putIfAbsent(link, GuidanceReference.builder()
                            .title(String.valueOf(result.getOrDefault("title", "")))
                            .link(link)
                            .snippet(String.valueOf(result.getOrDefault("snippet", "")))
                            .source(TRUSTED_DOMAIN)
                            .build());
                }
            }
        }
        log.info("Guidance search completed - contaminant: {}, references: {}", contaminant, references.size());
        return new ArrayList<>(references.values()).subList(0, Math.min(maxResults, references.size()));
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> organicResults(String query) {
        try {
            Map<String, Object> response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/search.json")
                            .queryParam("engine", "google")
                            .queryParam("q", query)
                            .queryParam("api_key", apiKey)
                            .queryParam("num", 5)
                            .queryParam("gl", "us")
                            .queryParam("hl", "en")
                            .build())
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});
            Object organic = response != null ? response.get("organic_results") : null;
            return organic instanceof List ? (List<Map<String, Object>>) organic : List.of();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ExternalCallTimeoutException("Guidance search timed out", e);
            }
            throw new ExternalCallException("Guidance search failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExternalCallException("Guidance search failed: " + e.getMessage(), e);
        }
    }
}

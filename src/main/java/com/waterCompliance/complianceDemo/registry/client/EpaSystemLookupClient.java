package com.waterCompliance.complianceDemo.registry.client;

import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallTimeoutException;
import com.waterCompliance.complianceDemo.registry.model.RecordedViolation;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import com.waterCompliance.complianceDemo.registry.repository.SystemCatalogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks systems up in the EPA SDWIS water_system table through the Envirofacts REST service,
 * together with the violations SDWIS has on file for them.
 * Catalog attributes the registry lacks (language mix, keywords) are merged in when known.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "registry.provider", havingValue = "epa")
public class EpaSystemLookupClient implements SystemLookupClient {

    private final RestClient restClient;
    private final SystemCatalogRepository systemCatalogRepository;

    public EpaSystemLookupClient(@Qualifier("externalRequestFactory") ClientHttpRequestFactory requestFactory,
                                 @Value("${registry.epa.base-url:https://data.epa.gov/efservice}") String baseUrl,
                                 SystemCatalogRepository systemCatalogRepository) {
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.systemCatalogRepository = systemCatalogRepository;
    }

    @Override
    public Optional<WaterSystemInfo> lookup(String pwsid) {
        List<Map<String, Object>> rows = fetchRows("/sdwis.water_system/pwsid/equals/{pwsid}/json", pwsid, "SDWIS lookup");
        if (rows == null || rows.isEmpty()) {
            log.info("System not found in SDWIS - pwsid: {}", pwsid);
            return Optional.empty();
        }
        return Optional.of(toSystemInfo(pwsid, rows.get(0)).toBuilder()
                .recordedViolations(recordedViolations(pwsid))
                .build());
    }

    /**
     * Violation history is supplementary: a failed history call leaves the system record without it.
     */
    private List<RecordedViolation> recordedViolations(String pwsid) {
        try {
            List<RecordedViolation> history = SdwisViolationMapper.toRecordedViolations(
                    fetchRows("/sdwis.violation/pwsid/equals/{pwsid}/json", pwsid, "SDWIS violation history"));
            log.debug("SDWIS violation history - pwsid: {}, violations: {}", pwsid, history.size());
            return history;
        } catch (ExternalCallException e) {
            log.warn("SDWIS violation history unavailable - pwsid: {}, error: {}", pwsid, e.getMessage());
            return List.of();
        }
    }

    private List<Map<String, Object>> fetchRows(String path, String pwsid, String what) {
        try {
            log.debug("Calling {} - pwsid: {}", what, pwsid);
            return restClient.get()
                    .uri(path, pwsid)
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<Map<String, Object>>>() {});
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ExternalCallTimeoutException(what + " timed out for " + pwsid, e);
            }
            throw new ExternalCallException(what + " failed for " + pwsid + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExternalCallException(what + " failed for " + pwsid + ": " + e.getMessage(), e);
        }
    }

    private WaterSystemInfo toSystemInfo(String pwsid, Map<String, Object> row) {
        Optional<WaterSystemInfo> catalogEntry = systemCatalogRepository.findByPwsid(pwsid);
        return WaterSystemInfo.builder()
                .pwsid(pwsid)
                .name(text(row.get("pws_name")))
                .populationServed(number(row.get("population_served_count")))
                .systemType(text(row.get("pws_type_code")))
                .activityStatus(text(row.get("pws_activity_code")))
                .city(text(row.get("city_name")))
                .state(text(row.get("state_code")))
                .nonEnglishSpeakingFraction(catalogEntry.map(WaterSystemInfo::getNonEnglishSpeakingFraction).orElse(null))
                .keywords(catalogEntry.map(WaterSystemInfo::getKeywords).orElse(null))
                .dataSource("sdwis")
                .build();
    }

    private static String text(Object value) {
        return value != null ? value.toString().trim() : null;
    }

    private static Long number(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("Unparseable population value: {}", value);
            }
        }
        return null;
    }
}

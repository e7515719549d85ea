package com.waterCompliance.complianceDemo.registry.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import com.waterCompliance.complianceDemo.util.JsonFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Recorded laboratory results keyed by system identifier. Used when a request names a
 * system but does not upload its own samples.
 */
@Repository
public class SampleDataRepository {

    private static final Logger log = LoggerFactory.getLogger(SampleDataRepository.class);

    private final Map<String, List<SampleRecord>> samplesByPwsid;

    public SampleDataRepository(@Value("${registry.samples-resource:data/samples.json}") String samplesResource) {
        this(load(samplesResource));
        log.info("Recorded samples loaded - resource: {}, systems: {}", samplesResource, samplesByPwsid.size());
    }

    public SampleDataRepository(Map<String, List<SampleRecord>> samplesByPwsid) {
        this.samplesByPwsid = samplesByPwsid.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().toUpperCase(Locale.ROOT),
                        entry -> List.copyOf(entry.getValue())));
    }

    /**
     * @return the recorded samples, or an empty list if none are on file
     */
    public List<SampleRecord> findByPwsid(String pwsid) {
        if (pwsid == null) {
            return List.of();
        }
        List<SampleRecord> samples = samplesByPwsid.getOrDefault(pwsid.toUpperCase(Locale.ROOT), List.of());
        log.debug("Sample lookup - pwsid: {}, samples: {}", pwsid, samples.size());
        return samples;
    }

    public int countByPwsid(String pwsid) {
        return findByPwsid(pwsid).size();
    }

    private static Map<String, List<SampleRecord>> load(String resource) {
        try {
            return JsonFileLoader.loadAsObject(resource, new TypeReference<Map<String, List<SampleRecord>>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load sample data from " + resource, e);
        }
    }
}

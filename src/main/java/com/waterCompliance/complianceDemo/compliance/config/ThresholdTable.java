package com.waterCompliance.complianceDemo.compliance.config;

import com.waterCompliance.complianceDemo.compliance.model.HealthSignificanceBand;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdEntry;
import com.waterCompliance.complianceDemo.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Regulatory threshold table plus health-significance bands, loaded once at startup.
 * Entry order is preserved; it drives the order of classified violations.
 */
@Slf4j
@Component
public class ThresholdTable {

    private final List<ThresholdEntry> entries;
    private final Map<String, ThresholdEntry> entriesByKey = new HashMap<>();
    private final Map<String, List<HealthSignificanceBand>> bandsByParameter;

    @Autowired
    public ThresholdTable(
            @Value("${compliance.thresholds.table-resource:thresholds/threshold-table.json}") String tableResource,
            @Value("${compliance.thresholds.health-resource:thresholds/health-significance.json}") String healthResource) {
        this(load(tableResource, ThresholdEntry.class), load(healthResource, HealthSignificanceBand.class));
        log.info("Threshold table loaded - resource: {}, entries: {}", tableResource, entries.size());
    }

    public ThresholdTable(List<ThresholdEntry> entries, List<HealthSignificanceBand> bands) {
        this.entries = entries.stream().map(ThresholdEntry::applyDefaults).toList();
        for (ThresholdEntry entry : this.entries) {
            for (String key : entry.lookupKeys()) {
                ThresholdEntry previous = entriesByKey.putIfAbsent(key, entry);
                if (previous != null && previous != entry) {
                    throw new IllegalStateException("Duplicate threshold key '" + key + "' for "
                            + previous.getParameter() + " and " + entry.getParameter());
                }
            }
        }
        this.bandsByParameter = bands.stream()
                .collect(Collectors.groupingBy(band -> ThresholdEntry.normalizeKey(band.getParameter())));
    }

    public List<ThresholdEntry> getEntries() {
        return entries;
    }

    public Optional<ThresholdEntry> find(String parameter) {
        return Optional.ofNullable(entriesByKey.get(ThresholdEntry.normalizeKey(parameter)));
    }

    /**
     * Highest band severity whose minimum ratio is reached, or empty when none applies.
     */
    public Optional<RiskLevel> healthSeverity(String parameter, double exceedanceRatio) {
        return bandsByParameter.getOrDefault(ThresholdEntry.normalizeKey(parameter), List.of()).stream()
                .filter(band -> exceedanceRatio >= band.getMinRatio())
                .map(HealthSignificanceBand::getSeverity)
                .max(Comparator.comparingInt(RiskLevel::getRank));
    }

    private static <T> List<T> load(String resource, Class<T> type) {
        try {
            return JsonFileLoader.loadAsList(resource, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load threshold data from " + resource, e);
        }
    }
}

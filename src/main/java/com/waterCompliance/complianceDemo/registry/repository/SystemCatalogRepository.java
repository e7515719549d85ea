package com.waterCompliance.complianceDemo.registry.repository;

import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import com.waterCompliance.complianceDemo.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of known public water systems, loaded from a classpath JSON file.
 */
@Slf4j
@Repository
public class SystemCatalogRepository {

    private final List<WaterSystemInfo> systems;

    public SystemCatalogRepository(@Value("${registry.catalog-resource:data/systems.json}") String catalogResource) {
        this(JsonFileLoader.loadAsListOrEmpty(catalogResource, WaterSystemInfo.class));
        log.info("System catalog loaded - resource: {}, systems: {}", catalogResource, systems.size());
    }

    public SystemCatalogRepository(List<WaterSystemInfo> systems) {
        this.systems = List.copyOf(systems);
    }

    public List<WaterSystemInfo> findAll() {
        return systems;
    }

    public Optional<WaterSystemInfo> findByPwsid(String pwsid) {
        if (pwsid == null) {
            return Optional.empty();
        }
        return systems.stream()
                .filter(system -> system.getPwsid().equalsIgnoreCase(pwsid.trim()))
                .findFirst();
    }

    /**
     * First system whose keywords or name occur in the given text, in catalog order.
     */
    public Optional<WaterSystemInfo> findByMention(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return systems.stream()
                .filter(system -> mentions(lower, system))
                .findFirst();
    }

    private static boolean mentions(String lowerText, WaterSystemInfo system) {
        if (system.getName() != null && lowerText.contains(system.getName().toLowerCase(Locale.ROOT))) {
            return true;
        }
        List<String> keywords = system.getKeywords();
        return keywords != null && keywords.stream()
                .anyMatch(keyword -> lowerText.contains(keyword.toLowerCase(Locale.ROOT)));
    }
}

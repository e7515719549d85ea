package com.waterCompliance.complianceDemo.gateway.controller;

import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import com.waterCompliance.complianceDemo.registry.repository.SampleDataRepository;
import com.waterCompliance.complianceDemo.registry.repository.SystemCatalogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the water systems known to the catalog, with how many recorded samples each has.
 */
@RestController
@RequestMapping("/api/v1/systems")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class SystemCatalogController {

    private final SystemCatalogRepository systemCatalogRepository;
    private final SampleDataRepository sampleDataRepository;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listSystems() {
        List<Map<String, Object>> systems = systemCatalogRepository.findAll().stream()
                .map(this::describe)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("systems", systems);
        response.put("totalSystems", systems.size());
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> describe(WaterSystemInfo system) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("pwsid", system.getPwsid());
        entry.put("name", system.getName());
        entry.put("location", system.location());
        entry.put("populationServed", system.getPopulationServed());
        entry.put("recordedSamples", sampleDataRepository.countByPwsid(system.getPwsid()));
        return entry;
    }
}

package com.waterCompliance.complianceDemo.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Registry record of a public water system.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WaterSystemInfo {
    private String pwsid;
    private String name;
    private String description;
    private Long populationServed;
    private String systemType;
    private String activityStatus;
    private String city;
    private String state;
    private Double nonEnglishSpeakingFraction;
    private List<String> keywords;
    private String dataSource;
    private List<RecordedViolation> recordedViolations;

    public String location() {
        if (city == null && state == null) {
            return null;
        }
        if (city == null) {
            return state;
        }
        return state == null ? city : city + ", " + state;
    }
}

package com.waterCompliance.complianceDemo.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One laboratory result for one parameter. Fields are nullable on purpose: incomplete
 * records are reported by the validation stage rather than rejected at the API boundary.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SampleRecord {
    private String parameter;
    private Double result;
    private String unit;
    private Instant collectedAt;
    private String locationId;

    /**
     * Presence/absence results are encoded as 1 (present) or 0 (absent); organism counts above zero also count as present.
     */
    public boolean indicatesPresence() {
        return result != null && result > 0;
    }
}

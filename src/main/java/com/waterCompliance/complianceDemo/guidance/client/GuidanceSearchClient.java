package com.waterCompliance.complianceDemo.guidance.client;

import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;

import java.util.List;

/**
 * Finds regulator-published treatment and corrective action guidance for a contaminant.
 */
public interface GuidanceSearchClient {

    List<GuidanceReference> search(String contaminant, String violationType);
}

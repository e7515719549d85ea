package com.waterCompliance.complianceDemo.compliance.model;

public enum PercentileMethod {
    /** Sorted ascending, 0-based index {@code ceil(p * (n - 1))}. */
    NEAREST_RANK,
    LINEAR_INTERPOLATION
}

package com.waterCompliance.complianceDemo.compliance.model;

/**
 * How the individual sample results for one parameter are reduced to the value
 * compared against the threshold.
 */
public enum StatisticMethod {
    PRESENCE,
    MAXIMUM,
    PERCENTILE,
    ARITHMETIC_MEAN,
    GEOMETRIC_MEAN
}

package com.waterCompliance.complianceDemo.compliance.model;

public enum DistributionMethod {
    BROADCAST_MEDIA,
    DIRECT_POSTING,
    DIRECT_MAIL,
    HAND_DELIVERY,
    ANNUAL_REPORT
}

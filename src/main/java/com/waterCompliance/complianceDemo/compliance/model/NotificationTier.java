package com.waterCompliance.complianceDemo.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.List;

/**
 * Public notification tiers (40 CFR 141 Subpart Q). Each tier fixes the delivery
 * deadline and the distribution channels a notice must use.
 */
public enum NotificationTier {
    TIER_1(1, RiskLevel.CRITICAL, "24 hours", Duration.ofHours(24),
            List.of(DistributionMethod.BROADCAST_MEDIA, DistributionMethod.DIRECT_POSTING)),
    TIER_2(2, RiskLevel.HIGH, "30 days", Duration.ofDays(30),
            List.of(DistributionMethod.DIRECT_MAIL, DistributionMethod.HAND_DELIVERY)),
    TIER_3(3, RiskLevel.MEDIUM, "1 year", Duration.ofDays(365),
            List.of(DistributionMethod.ANNUAL_REPORT, DistributionMethod.DIRECT_MAIL));

    private final int number;
    private final RiskLevel baseSeverity;
    private final String deadline;
    private final Duration deadlineWindow;
    private final List<DistributionMethod> distributionMethods;

    NotificationTier(int number, RiskLevel baseSeverity, String deadline, Duration deadlineWindow,
                     List<DistributionMethod> distributionMethods) {
        this.number = number;
        this.baseSeverity = baseSeverity;
        this.deadline = deadline;
        this.deadlineWindow = deadlineWindow;
        this.distributionMethods = distributionMethods;
    }

    @JsonValue
    public int getNumber() {
        return number;
    }

    public RiskLevel getBaseSeverity() {
        return baseSeverity;
    }

    public String getDeadline() {
        return deadline;
    }

    public Duration getDeadlineWindow() {
        return deadlineWindow;
    }

    public List<DistributionMethod> getDistributionMethods() {
        return distributionMethods;
    }

    @JsonCreator
    public static NotificationTier fromNumber(int number) {
        for (NotificationTier tier : values()) {
            if (tier.number == number) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown notification tier: " + number);
    }
}

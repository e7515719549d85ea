package com.waterCompliance.complianceDemo.compliance.util;

import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.StatisticMethod;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdKind;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Drafts the body of a public notice for one violation. The draft is a starting point for the
 * operator; it names the system, the finding, its health effects and the delivery obligation.
 */
public final class PublicNoticeDrafter {

    private static final String UNKNOWN_SYSTEM_HEADER = "Public Water System (PWSID: unknown)";

    private PublicNoticeDrafter() {}

    public static String draft(Violation violation, WaterSystemInfo system, boolean multiLanguage) {
        NotificationTier tier = violation.getTier();
        StringBuilder notice = new StringBuilder();
        notice.append(tier == NotificationTier.TIER_1 ? "IMMEDIATE PUBLIC NOTICE" : "PUBLIC NOTICE")
                .append(" - TIER ").append(tier.getNumber()).append(" VIOLATION\n")
                .append(systemHeader(system)).append("\n\n");

        boolean monitoring = violation.getThresholdKind() == ThresholdKind.MONITORING_REQUIREMENT;
        boolean presence = violation.getStatistic() == StatisticMethod.PRESENCE;
        if (tier == NotificationTier.TIER_1 && presence && !monitoring) {
            notice.append("URGENT: DO NOT DRINK THE WATER WITHOUT BOILING IT FIRST\n\n");
        }
        notice.append(summary(violation, monitoring, presence)).append("\n\n");

        if (!monitoring) {
            notice.append("VIOLATION DETAILS:\n");
            if (!presence) {
                notice.append("- Measured ").append(statisticLabel(violation.getStatistic())).append(": ")
                        .append(format(violation.getMeasuredValue())).append(' ').append(violation.getUnit()).append('\n')
                        .append("- EPA ").append(limitLabel(violation.getThresholdKind())).append(": ")
                        .append(format(violation.getThreshold())).append(' ').append(violation.getUnit()).append('\n');
                if (violation.getExceedanceRatio() != null) {
                    notice.append(String.format(Locale.ROOT, "- Exceedance factor: %.1fx%n", violation.getExceedanceRatio()));
                }
            }
            notice.append("- Samples evaluated: ").append(violation.getSampleCount()).append("\n\n");
        }

        if (violation.getHealthEffects() != null && !monitoring) {
            notice.append("HEALTH EFFECTS:\n").append(violation.getHealthEffects()).append("\n\n");
        }
        if (tier == NotificationTier.TIER_1 && !monitoring) {
            notice.append("IMMEDIATE ACTIONS REQUIRED:\n")
                    .append(presence
                            ? "- Boil all water for drinking, cooking and brushing teeth for at least 1 minute\n"
                            : "- Do not give the water to infants or use it to prepare formula\n")
                    .append("- Use bottled water if available\n")
                    .append("- Seek medical attention if you experience illness\n\n");
        }

        notice.append("Notification Requirements: ").append(tier.getDeadline()).append(" via ")
                .append(tier.getDistributionMethods().stream()
                        .map(method -> method.name().toLowerCase(Locale.ROOT).replace('_', ' '))
                        .collect(Collectors.joining(", ")))
                .append('\n')
                .append("Severity: ").append(violation.getSeverity());
        if (violation.getCitation() != null) {
            notice.append('\n').append("Regulation: ").append(violation.getCitation());
        }
        if (multiLanguage) {
            notice.append('\n').append("This notice must also be provided in the languages spoken by the population served.");
        }
        return notice.toString();
    }

    static String systemHeader(WaterSystemInfo system) {
        if (system == null || system.getPwsid() == null) {
            return UNKNOWN_SYSTEM_HEADER;
        }
        String name = system.getName() != null ? system.getName() : "Public Water System";
        return name + " (PWSID: " + system.getPwsid() + ")";
    }

    private static String summary(Violation violation, boolean monitoring, boolean presence) {
        String parameter = violation.getParameter();
        if (monitoring) {
            return "Required monitoring for " + parameter + " was not performed. We cannot be sure of the quality "
                    + "of your drinking water for " + parameter + " during this period.";
        }
        if (presence) {
            return parameter + " was detected in your drinking water.";
        }
        return parameter + " levels in your drinking water exceed the EPA " + limitLabel(violation.getThresholdKind()) + ".";
    }

    private static String statisticLabel(StatisticMethod statistic) {
        return switch (statistic) {
            case PERCENTILE -> "90th percentile";
            case MAXIMUM, PRESENCE -> "maximum";
            case ARITHMETIC_MEAN -> "average";
            case GEOMETRIC_MEAN -> "geometric mean";
        };
    }

    private static String limitLabel(ThresholdKind kind) {
        return kind == ThresholdKind.ACTION_LEVEL ? "action level" : "maximum contaminant level";
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value).replaceAll("\\.?0+$", "");
    }
}

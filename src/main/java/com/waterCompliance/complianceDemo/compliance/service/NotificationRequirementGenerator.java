package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.model.ContentElement;
import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.compliance.util.PublicNoticeDrafter;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps violations to public notification obligations. Deadline and distribution
 * methods come from the violation's tier; every notice carries all mandatory content elements
 * and a drafted notice body.
 */
@Component
public class NotificationRequirementGenerator {

    private final double multiLanguageThreshold;

    public NotificationRequirementGenerator(
            @Value("${compliance.notification.multi-language-threshold:0.10}") double multiLanguageThreshold) {
        this.multiLanguageThreshold = multiLanguageThreshold;
    }

    /**
     * @param nonEnglishFraction share of the served population with limited English, or null if unknown
     * @param system the affected system for the notice header, or null if the registry lookup failed
     */
    public NotificationRequirement generateRequirement(Violation violation, Double nonEnglishFraction,
                                                       WaterSystemInfo system) {
        NotificationTier tier = violation.getTier();
        boolean multiLanguage = nonEnglishFraction != null && nonEnglishFraction > multiLanguageThreshold;
        return NotificationRequirement.builder()
                .parameter(violation.getParameter())
                .tier(tier)
                .deadline(tier.getDeadline())
                .deadlineWindow(tier.getDeadlineWindow())
                .methods(tier.getDistributionMethods())
                .requiredContent(ContentElement.REQUIRED)
                .multiLanguageRequired(multiLanguage)
                .citation(violation.getCitation())
                .noticeText(PublicNoticeDrafter.draft(violation, system, multiLanguage))
                .build();
    }

    public List<NotificationRequirement> generateAll(List<Violation> violations, Double nonEnglishFraction,
                                                     WaterSystemInfo system) {
        if (violations == null) {
            return List.of();
        }
        return violations.stream()
                .map(violation -> generateRequirement(violation, nonEnglishFraction, system))
                .toList();
    }
}

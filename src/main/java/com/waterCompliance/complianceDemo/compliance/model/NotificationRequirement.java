package com.waterCompliance.complianceDemo.compliance.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class NotificationRequirement {
    String parameter;
    NotificationTier tier;
    String deadline;
    Duration deadlineWindow;
    List<DistributionMethod> methods;
    List<ContentElement> requiredContent;
    boolean multiLanguageRequired;
    String citation;
    /** Draft notice body for the operator to review before distribution. */
    String noticeText;
}

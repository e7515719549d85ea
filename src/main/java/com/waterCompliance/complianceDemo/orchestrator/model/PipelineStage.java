package com.waterCompliance.complianceDemo.orchestrator.model;

import java.util.List;

/**
 * Session state machine. Work stages run strictly in declaration order;
 * COMPLETE and ERROR are terminal.
 */
public enum PipelineStage {
    IDLE(null, "Idle"),
    VALIDATING("data-validator", "Data Validator"),
    DETECTING_VIOLATIONS("violation-analyst", "Violation Analyst"),
    GENERATING_NOTIFICATIONS("notification-specialist", "Notification Specialist"),
    SYNTHESIZING("report-synthesizer", "Report Synthesizer"),
    COMPLETE(null, "Complete"),
    ERROR(null, "Error");

    public static final List<PipelineStage> WORK_STAGES =
            List.of(VALIDATING, DETECTING_VIOLATIONS, GENERATING_NOTIFICATIONS, SYNTHESIZING);

    private final String agentId;
    private final String displayName;

    PipelineStage(String agentId, String displayName) {
        this.agentId = agentId;
        this.displayName = displayName;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public boolean isWorkStage() {
        return agentId != null;
    }

    /**
     * Successor on the happy path. ERROR is reached through {@code AnalysisSession#fail}, never through here.
     */
    public PipelineStage next() {
        return switch (this) {
            case IDLE -> VALIDATING;
            case VALIDATING -> DETECTING_VIOLATIONS;
            case DETECTING_VIOLATIONS -> GENERATING_NOTIFICATIONS;
            case GENERATING_NOTIFICATIONS -> SYNTHESIZING;
            case SYNTHESIZING -> COMPLETE;
            case COMPLETE, ERROR -> throw new IllegalStateException("No stage follows terminal stage " + this);
        };
    }
}

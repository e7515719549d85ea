package com.waterCompliance.complianceDemo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StageStatus {
    IDLE,
    RUNNING,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

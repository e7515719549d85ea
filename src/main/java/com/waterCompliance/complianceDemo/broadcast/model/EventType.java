package com.waterCompliance.complianceDemo.broadcast.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    ANALYSIS_START,
    AGENT_UPDATE,
    ANALYSIS_COMPLETE,
    ERROR,
    STATUS;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.apiresilience.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}

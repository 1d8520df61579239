package com.apiresilience.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorType {
    AUTHENTICATION("authentication"),
    RATE_LIMIT("rate_limit"),
    NETWORK("network"),
    VALIDATION("validation"),
    API_ERROR("api_error"),
    UNKNOWN("unknown");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

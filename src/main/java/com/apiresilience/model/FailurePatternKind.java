package com.apiresilience.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FailurePatternKind {
    NO_ERRORS("no_errors", Severity.LOW,
        "Network is operating normally"),
    HIGH_TIMEOUT_RATE("high_timeout_rate", Severity.HIGH,
        "Increase timeout values or check network latency. Consider reducing request frequency."),
    CONNECTION_INSTABILITY("connection_instability", Severity.HIGH,
        "Check network connectivity and firewall settings. The remote API may be experiencing issues."),
    DNS_RESOLUTION_FAILURE("dns_resolution_failure", Severity.MEDIUM,
        "Check DNS settings and network configuration. Try using alternative DNS servers."),
    GENERAL_NETWORK_INSTABILITY("general_network_instability", Severity.MEDIUM,
        "Network appears unstable. Consider implementing circuit breaker pattern or reducing request rate."),
    SPORADIC_ERRORS("sporadic_errors", Severity.LOW,
        "Occasional network errors are normal. Monitor for patterns.");

    private final String tag;
    private final Severity severity;
    private final String recommendation;

    FailurePatternKind(String tag, Severity severity, String recommendation) {
        this.tag = tag;
        this.severity = severity;
        this.recommendation = recommendation;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getRecommendation() {
        return recommendation;
    }
}

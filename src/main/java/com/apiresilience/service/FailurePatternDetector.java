package com.apiresilience.service;

import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.FailurePattern;
import com.apiresilience.model.FailurePatternKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Summarizes the most recent classified errors into a single {@link FailurePattern}.
 * Rules are evaluated in order and the first match wins.
 */
public class FailurePatternDetector {
    static final int RECENT_WINDOW = 10;

    public FailurePattern detect(List<ClassifiedError> history) {
        if (history == null || history.isEmpty()) {
            return new FailurePattern(FailurePatternKind.NO_ERRORS, 0);
        }

        List<ClassifiedError> recent = history.subList(Math.max(0, history.size() - RECENT_WINDOW), history.size())
            .stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
        if (recent.isEmpty()) {
            return new FailurePattern(FailurePatternKind.NO_ERRORS, 0);
        }

        long timeouts = recent.stream().filter(FailurePatternDetector::isTimeout).count();
        long connectionFailures = recent.stream()
            .filter(error -> "ECONNREFUSED".equals(error.getErrorCode()) || "ECONNRESET".equals(error.getErrorCode()))
            .count();
        long dnsFailures = recent.stream().filter(error -> "ENOTFOUND".equals(error.getErrorCode())).count();

        FailurePatternKind kind;
        if (timeouts >= 5) {
            kind = FailurePatternKind.HIGH_TIMEOUT_RATE;
        } else if (connectionFailures >= 5) {
            kind = FailurePatternKind.CONNECTION_INSTABILITY;
        } else if (dnsFailures >= 3) {
            kind = FailurePatternKind.DNS_RESOLUTION_FAILURE;
        } else if (recent.size() >= 5) {
            kind = FailurePatternKind.GENERAL_NETWORK_INSTABILITY;
        } else {
            kind = FailurePatternKind.SPORADIC_ERRORS;
        }
        return new FailurePattern(kind, recent.size());
    }

    static boolean isTimeout(ClassifiedError error) {
        if ("ETIMEDOUT".equals(error.getErrorCode())) {
            return true;
        }
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("timeout") || message.contains("timed out");
    }
}

package com.apiresilience.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class FailurePattern {
    private final FailurePatternKind kind;
    private final int sampleSize;

    public FailurePattern(FailurePatternKind kind, int sampleSize) {
        this.kind = kind;
        this.sampleSize = sampleSize;
    }

    @JsonIgnore
    public FailurePatternKind getKind() {
        return kind;
    }

    public String getPattern() {
        return kind.getTag();
    }

    public Severity getSeverity() {
        return kind.getSeverity();
    }

    public String getRecommendation() {
        return kind.getRecommendation();
    }

    /**
     * Number of history entries the pattern was derived from.
     */
    public int getSampleSize() {
        return sampleSize;
    }
}

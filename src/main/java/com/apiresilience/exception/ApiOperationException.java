package com.apiresilience.exception;

import com.apiresilience.model.ClassifiedError;

/**
 * Caller-facing failure of a remote operation: formatted message, numeric code, troubleshooting text and
 * whether the caller has to fix its input.
 */
public class ApiOperationException extends RuntimeException {
    public enum Kind {
        CALLER_INPUT,
        OPERATIONAL
    }

    private final Kind kind;
    private final int code;
    private final String troubleshooting;
    private final transient ClassifiedError error;

    public ApiOperationException(Kind kind, String message, int code, String troubleshooting, ClassifiedError error) {
        super(message, error != null ? error.getCause() : null);
        this.kind = kind;
        this.code = code;
        this.troubleshooting = troubleshooting;
        this.error = error;
    }

    public Kind getKind() {
        return kind;
    }

    public int getCode() {
        return code;
    }

    public String getTroubleshooting() {
        return troubleshooting;
    }

    public ClassifiedError getError() {
        return error;
    }
}

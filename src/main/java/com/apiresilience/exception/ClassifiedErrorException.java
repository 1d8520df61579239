package com.apiresilience.exception;

import com.apiresilience.model.ClassifiedError;

/**
 * Terminal failure of a retried call, carrying the last classified error.
 */
public class ClassifiedErrorException extends RuntimeException {
    private final ClassifiedError error;

    public ClassifiedErrorException(ClassifiedError error) {
        super(error.getMessage(), error.getCause());
        this.error = error;
    }

    public ClassifiedError getError() {
        return error;
    }
}

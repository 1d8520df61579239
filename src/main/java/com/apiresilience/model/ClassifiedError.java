package com.apiresilience.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized description of a failed remote call.
 *
 * <p>Equality ignores {@link #getTimestamp()}, so classifying the same failure twice yields equal values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ClassifiedError {
    private final ErrorType type;
    private final int code;
    private final String message;
    private final boolean retryable;
    private final Integer retryAfterSeconds;
    private final Map<String, Object> details;
    private final Instant timestamp;
    private final Throwable cause;

    private ClassifiedError(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.code = builder.code;
        this.message = builder.message;
        this.retryable = builder.retryable;
        this.retryAfterSeconds = builder.retryAfterSeconds;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.cause = builder.cause;
    }

    public static Builder builder(ErrorType type) {
        return new Builder(type);
    }

    public ErrorType getType() {
        return type;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Seconds the remote side asked us to wait, or {@code null} when it did not say.
     */
    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean hasRetryAfter() {
        return retryAfterSeconds != null;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * Convenience accessor for the transport error code recorded in {@link #getDetails()}.
     */
    @JsonIgnore
    public String getErrorCode() {
        Object errorCode = details.get("errorCode");
        return errorCode == null ? null : errorCode.toString();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public Throwable getCause() {
        return cause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClassifiedError)) {
            return false;
        }
        ClassifiedError that = (ClassifiedError) o;
        return code == that.code
            && retryable == that.retryable
            && type == that.type
            && Objects.equals(message, that.message)
            && Objects.equals(retryAfterSeconds, that.retryAfterSeconds)
            && Objects.equals(details, that.details)
            && Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, code, message, retryable, retryAfterSeconds, details, cause);
    }

    @Override
    public String toString() {
        return "ClassifiedError{type=" + type.getValue() + ", code=" + code + ", retryable=" + retryable
            + (retryAfterSeconds != null ? ", retryAfterSeconds=" + retryAfterSeconds : "")
            + ", message='" + message + "'}";
    }

    public static final class Builder {
        private final ErrorType type;
        private int code;
        private String message;
        private boolean retryable;
        private Integer retryAfterSeconds;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private Instant timestamp;
        private Throwable cause;

        private Builder(ErrorType type) {
            this.type = type;
        }

        public Builder code(int code) {
            this.code = code;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder retryAfterSeconds(Integer retryAfterSeconds) {
            this.retryAfterSeconds = retryAfterSeconds;
            return this;
        }

        // null values are dropped so absent fields stay absent
        public Builder detail(String key, Object value) {
            if (value != null) {
                this.details.put(key, value);
            }
            return this;
        }

        public Builder details(Map<String, ?> details) {
            if (details != null) {
                details.forEach(this::detail);
            }
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public ClassifiedError build() {
            return new ClassifiedError(this);
        }
    }
}

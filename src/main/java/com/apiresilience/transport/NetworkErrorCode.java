package com.apiresilience.transport;

/**
 * Transport-level failure codes, named after the socket error codes remote clients commonly report.
 */
public enum NetworkErrorCode {
    CONNECTION_REFUSED("ECONNREFUSED", true),
    DNS_NOT_FOUND("ENOTFOUND", true),
    TIMED_OUT("ETIMEDOUT", true),
    CONNECTION_RESET("ECONNRESET", true),
    CONNECTION_ABORTED("ECONNABORTED", true),
    NETWORK_UNREACHABLE("ENETUNREACH", true),
    CERTIFICATE("CERT_ERROR", false),
    OTHER(null, true);

    private final String code;
    private final boolean retryable;

    NetworkErrorCode(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Resolves a raw code string. Any {@code CERT_*} code maps to {@link #CERTIFICATE};
     * unknown or null codes map to {@link #OTHER}.
     */
    public static NetworkErrorCode fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        if (code.startsWith("CERT_") || code.startsWith("ERR_TLS") || code.startsWith("ERR_SSL")) {
            return CERTIFICATE;
        }
        for (NetworkErrorCode value : values()) {
            if (code.equals(value.code)) {
                return value;
            }
        }
        return OTHER;
    }
}

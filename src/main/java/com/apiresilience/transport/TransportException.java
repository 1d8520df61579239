package com.apiresilience.transport;

import java.io.IOException;

/**
 * Transport failure carrying an explicit socket-style error code such as {@code ECONNRESET}
 * or {@code CERT_HAS_EXPIRED}.
 */
public class TransportException extends IOException {
    private final String errorCode;
    private final String host;
    private final Integer port;

    public TransportException(String errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public TransportException(String errorCode, String message, String host, Integer port, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.host = host;
        this.port = port;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public NetworkErrorCode getNetworkErrorCode() {
        return NetworkErrorCode.fromCode(errorCode);
    }

    public String getHost() {
        return host;
    }

    public Integer getPort() {
        return port;
    }
}

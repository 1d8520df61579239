package com.apiresilience.transport;

/**
 * Raised when the remote API answered with an error status.
 */
public class ApiResponseException extends RuntimeException {
    private final HttpResponseData response;

    public ApiResponseException(HttpResponseData response) {
        super("HTTP " + response.getStatusCode());
        this.response = response;
    }

    public HttpResponseData getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.getStatusCode();
    }
}

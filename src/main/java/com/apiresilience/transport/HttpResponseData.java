package com.apiresilience.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class HttpResponseData {
    private final int statusCode;
    private final String body;
    private final Map<String, List<String>> headers;
    private final Duration duration;

    public HttpResponseData(int statusCode, String body, Map<String, List<String>> headers, Duration duration) {
        this.statusCode = statusCode;
        this.body = body;
        this.headers = headers == null ? Collections.emptyMap() : headers;
        this.duration = duration;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * First value of the named header, matched case-insensitively.
     */
    public String firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    public boolean isError() {
        return statusCode >= 400;
    }
}

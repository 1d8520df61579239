package com.apiresilience.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single HTTP exchange to send through the pooled transport.
 */
public class ApiRequest {
    private final HttpMethod method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;
    private final String contentType;
    private final Duration timeout;

    public ApiRequest(HttpMethod method, String url, Map<String, String> headers, String body,
                      String contentType, Duration timeout) {
        this.method = method;
        this.url = url;
        this.headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.contentType = contentType == null && body != null ? "application/json" : contentType;
        this.timeout = timeout;
    }

    public static ApiRequest get(String url) {
        return new ApiRequest(HttpMethod.GET, url, null, null, null, null);
    }

    public static ApiRequest post(String url, String body) {
        return new ApiRequest(HttpMethod.POST, url, null, body, null, null);
    }

    public ApiRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiRequest(method, url, copy, body, contentType, timeout);
    }

    public ApiRequest withTimeout(Duration timeout) {
        return new ApiRequest(method, url, headers, body, contentType, timeout);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Per-request timeout, or {@code null} to rely on the engine's attempt timeout.
     */
    public Duration getTimeout() {
        return timeout;
    }
}

package com.apiresilience.transport;

import com.apiresilience.service.CancellationToken;

import java.util.concurrent.CompletableFuture;

public interface HttpTransport {

    /**
     * Sends the request. The future fails with {@link ApiResponseException} for status codes of 400 and above,
     * and is aborted when {@code token} is cancelled.
     */
    CompletableFuture<HttpResponseData> send(ApiRequest request, CancellationToken token);
}

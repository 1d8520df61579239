package com.apiresilience.service;

import com.apiresilience.exception.RequestValidationException;
import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.ErrorType;
import com.apiresilience.transport.ApiResponseException;
import com.apiresilience.transport.HttpResponseData;
import com.apiresilience.transport.TransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

public class ErrorClassifierTest {
    private final ErrorClassifier classifier = new ErrorClassifier();

    private static ApiResponseException response(int status, String body, Map<String, List<String>> headers) {
        return new ApiResponseException(new HttpResponseData(status, body, headers, Duration.ofMillis(5)));
    }

    private static ApiResponseException response(int status) {
        return response(status, "", Map.of());
    }

    @ParameterizedTest
    @ValueSource(ints = {401, 403})
    void authenticationStatusesAreNotRetryable(int status) {
        ClassifiedError error = classifier.classify(response(status));

        assertThat(error.getType()).isEqualTo(ErrorType.AUTHENTICATION);
        assertThat(error.getCode()).isEqualTo(status);
        assertThat(error.isRetryable()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 502, 503, 504})
    void serverErrorsAreRetryable(int status) {
        ClassifiedError error = classifier.classify(response(status));

        assertThat(error.getType()).isEqualTo(ErrorType.API_ERROR);
        assertThat(error.isRetryable()).isTrue();
    }

    @Test
    void notFoundIsNotRetryable() {
        ClassifiedError error = classifier.classify(response(404, "{\"message\":\"Blog not found\"}", Map.of()));

        assertThat(error.getType()).isEqualTo(ErrorType.API_ERROR);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error.getMessage()).isEqualTo("Resource not found - Blog not found");
    }

    @Test
    void otherStatusesAreRetryableOnlyWhenServerSide() {
        ClassifiedError teapot = classifier.classify(response(418));
        ClassifiedError storage = classifier.classify(response(507));

        assertThat(teapot.getType()).isEqualTo(ErrorType.API_ERROR);
        assertThat(teapot.isRetryable()).isFalse();
        assertThat(teapot.getMessage()).isEqualTo("HTTP 418: Unknown API error");
        assertThat(storage.isRetryable()).isTrue();
    }

    @Test
    void badRequestIncludesRemoteErrors() {
        ClassifiedError error = classifier.classify(response(400, "{\"errors\":[\"title is required\"]}", Map.of()));

        assertThat(error.getType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error.getMessage()).isEqualTo("Bad request: [\"title is required\"]");
        assertThat(error.getDetails()).containsKey("errors");
    }

    @Test
    void nonJsonBodyIsKeptAsPreview() {
        ClassifiedError error = classifier.classify(response(502, "<html>bad gateway</html>", Map.of()));

        assertThat(error.getDetails()).containsEntry("body", "<html>bad gateway</html>");
    }

    @Test
    void rateLimitReadsRetryAfterHeader() {
        ClassifiedError error = classifier.classify(response(429, "", Map.of("Retry-After", List.of("60"))));

        assertThat(error.getType()).isEqualTo(ErrorType.RATE_LIMIT);
        assertThat(error.isRetryable()).isTrue();
        assertThat(error.getRetryAfterSeconds()).isEqualTo(60);
        assertThat(error.getMessage()).endsWith("Retry after 60 seconds");
    }

    @Test
    void rateLimitIgnoresNonNumericRetryAfter() {
        ClassifiedError error = classifier.classify(response(429, "", Map.of("retry-after", List.of("invalid"))));

        assertThat(error.getType()).isEqualTo(ErrorType.RATE_LIMIT);
        assertThat(error.hasRetryAfter()).isFalse();
        assertThat(error.getMessage()).endsWith("Please wait before making more requests");
    }

    @Test
    void zeroRetryAfterIsKept() {
        ClassifiedError error = classifier.classify(response(429, "", Map.of("retry-after", List.of("0"))));

        assertThat(error.getRetryAfterSeconds()).isZero();
    }

    @Test
    void connectionRefusedNamesTheOperation() {
        ClassifiedError error = classifier.classify(new ConnectException("Connection refused"), "create_post");

        assertThat(error.getType()).isEqualTo(ErrorType.NETWORK);
        assertThat(error.isRetryable()).isTrue();
        assertThat(error.getErrorCode()).isEqualTo("ECONNREFUSED");
        assertThat(error.getMessage()).contains("create_post");
        assertThat(error.getDetails()).containsEntry("operationName", "create_post");
    }

    @Test
    void networkCodesGetDistinctMessages() {
        ClassifiedError refused = classifier.classify(new TransportException("ECONNREFUSED", "refused"));
        ClassifiedError dns = classifier.classify(new UnknownHostException("api.example.com"));
        ClassifiedError reset = classifier.classify(new SocketException("Connection reset"));
        ClassifiedError aborted = classifier.classify(new TransportException("ECONNABORTED", "aborted"));
        ClassifiedError timeout = classifier.classify(new HttpTimeoutException("request timed out"));

        assertThat(dns.getErrorCode()).isEqualTo("ENOTFOUND");
        assertThat(dns.getDetails()).containsEntry("hostname", "api.example.com");
        assertThat(reset.getErrorCode()).isEqualTo("ECONNRESET");
        assertThat(aborted.getErrorCode()).isEqualTo("ECONNABORTED");
        assertThat(timeout.getErrorCode()).isEqualTo("ETIMEDOUT");
        assertThat(timeout.getCode()).isEqualTo(408);
        assertThat(List.of(refused, dns, reset, aborted, timeout))
            .allMatch(ClassifiedError::isRetryable)
            .extracting(ClassifiedError::getMessage)
            .doesNotHaveDuplicates();
    }

    @Test
    void attemptTimeoutReportsTheLimit() {
        ClassifiedError error = classifier.classify(new AttemptTimeoutException(250), "fetch_blog");

        assertThat(error.getType()).isEqualTo(ErrorType.NETWORK);
        assertThat(error.getCode()).isEqualTo(408);
        assertThat(error.getMessage()).isEqualTo("Network timeout during fetch_blog - Operation exceeded 250ms limit");
        assertThat(error.getDetails()).containsEntry("timeoutMs", 250L);
    }

    @Test
    void certificateFailuresAreNotRetryable() {
        ClassifiedError handshake = classifier.classify(new SSLHandshakeException("PKIX path building failed"));
        ClassifiedError expired = classifier.classify(new TransportException("CERT_HAS_EXPIRED", "certificate has expired"));

        assertThat(handshake.getType()).isEqualTo(ErrorType.NETWORK);
        assertThat(handshake.isRetryable()).isFalse();
        assertThat(handshake.getErrorCode()).isEqualTo("CERT_ERROR");
        assertThat(expired.isRetryable()).isFalse();
        assertThat(expired.getErrorCode()).isEqualTo("CERT_HAS_EXPIRED");
    }

    @Test
    void wrappedFailuresAreUnwrapped() {
        ClassifiedError completion = classifier.classify(new CompletionException(new ConnectException("refused")));
        ClassifiedError io = classifier.classify(new IOException("send failed", new ConnectException()));
        ClassifiedError http = classifier.classify(new CompletionException(response(503)));

        assertThat(completion.getErrorCode()).isEqualTo("ECONNREFUSED");
        assertThat(io.getErrorCode()).isEqualTo("ECONNREFUSED");
        assertThat(http.getCode()).isEqualTo(503);
    }

    @Test
    void validationFailuresListFields() {
        ClassifiedError error = classifier.classify(
            new RequestValidationException("invalid post", Map.of("title", "must not be blank")));

        assertThat(error.getType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(error.getCode()).isEqualTo(400);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error.getMessage()).isEqualTo("Validation failed - title: must not be blank");
    }

    @Test
    void typedValidationFailureMentioningTimeoutStaysValidation() {
        ClassifiedError error = classifier.classify(new RequestValidationException("timeoutMs must be positive"));
        ClassifiedError untyped = classifier.classify(new IllegalStateException("upstream timeout"));

        assertThat(error.getType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(error.getCode()).isEqualTo(400);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error.getMessage()).isEqualTo("Validation error: timeoutMs must be positive");
        assertThat(untyped.getType()).isEqualTo(ErrorType.NETWORK);
    }

    @Test
    void validationMessageWithoutFields() {
        ClassifiedError error = classifier.classify(new IllegalArgumentException("Schema validation rejected tags"));

        assertThat(error.getType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(error.getMessage()).isEqualTo("Validation error: Schema validation rejected tags");
    }

    @Test
    void authenticationKeywordsInMessage() {
        ClassifiedError token = classifier.classify(new IllegalStateException("Access token rejected"));
        ClassifiedError credentials = classifier.classify(new IllegalStateException("Missing credentials"));
        ClassifiedError auth = classifier.classify(new IllegalStateException("OAuth handshake refused"));

        assertThat(token.getType()).isEqualTo(ErrorType.AUTHENTICATION);
        assertThat(token.getCode()).isEqualTo(401);
        assertThat(token.getMessage()).isEqualTo("Authentication failed - Invalid or expired access token");
        assertThat(credentials.getMessage()).isEqualTo("Authentication failed - Invalid credentials provided");
        assertThat(auth.getMessage()).isEqualTo("Authentication failed - Please check your API credentials");
    }

    @Test
    void unknownFailuresFallBack() {
        ClassifiedError error = classifier.classify(new IllegalStateException("boom"));
        ClassifiedError empty = classifier.classify(null);

        assertThat(error.getType()).isEqualTo(ErrorType.UNKNOWN);
        assertThat(error.getCode()).isEqualTo(500);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error.getMessage()).isEqualTo("Unknown error occurred: boom");
        assertThat(empty.getMessage()).isEqualTo("Unknown error occurred: No error message available");
    }

    @Test
    void classificationIsDeterministic() {
        ApiResponseException failure = response(429, "{\"meta\":{\"status\":429}}", Map.of("retry-after", List.of("30")));

        assertThat(classifier.classify(failure, "op")).isEqualTo(classifier.classify(failure, "op"));
    }
}

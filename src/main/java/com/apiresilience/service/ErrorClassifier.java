package com.apiresilience.service;

import com.apiresilience.exception.RequestValidationException;
import com.apiresilience.model.ClassifiedError;
import com.apiresilience.model.ErrorType;
import com.apiresilience.transport.ApiResponseException;
import com.apiresilience.transport.HttpResponseData;
import com.apiresilience.transport.NetworkErrorCode;
import com.apiresilience.transport.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.security.cert.CertificateException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Maps any failure raised by a remote call to a {@link ClassifiedError}.
 *
 * <p>Classification order:
 * <ol>
 *   <li>HTTP error responses ({@link ApiResponseException}), by status code</li>
 *   <li>transport failures: explicit {@link TransportException} codes, then JDK socket/TLS/timeout types</li>
 *   <li>validation failures</li>
 *   <li>authentication keywords in the message</li>
 *   <li>fallback: {@link ErrorType#UNKNOWN}</li>
 * </ol>
 *
 * <p>Never throws. Only the timestamp differs between two classifications of the same failure.
 */
@Component
public class ErrorClassifier {
    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    public static final String DEFAULT_OPERATION_NAME = "api_operation";

    private static final int MAX_CAUSE_DEPTH = 5;
    private static final int BODY_PREVIEW_CHARS = 500;
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ErrorClassifier() {
        this(new ObjectMapper());
    }

    @Autowired
    public ErrorClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClassifiedError classify(Throwable raw) {
        return classify(raw, DEFAULT_OPERATION_NAME);
    }

    public ClassifiedError classify(Throwable raw, String operationName) {
        Instant timestamp = Instant.now();
        String operation = operationName == null || operationName.isBlank() ? DEFAULT_OPERATION_NAME : operationName;
        Throwable error = unwrap(raw);
        try {
            return doClassify(error, operation, timestamp);
        } catch (RuntimeException ex) {
            log.warn("Could not classify {}, reporting it as unknown", error, ex);
            return unknown(error, timestamp);
        }
    }

    private ClassifiedError doClassify(Throwable error, String operation, Instant timestamp) {
        if (error == null) {
            return unknown(null, timestamp);
        }

        ApiResponseException apiResponse = findApiResponse(error);
        if (apiResponse != null) {
            return classifyHttpError(apiResponse.getResponse(), error, timestamp);
        }

        // typed validation failures win over message heuristics such as "timeout"
        if (isTypedValidationError(error)) {
            return classifyValidationError(error, timestamp);
        }

        NetworkErrorCode networkCode = resolveNetworkCode(error, 0);
        if (networkCode != null) {
            return classifyNetworkError(error, networkCode, operation, timestamp);
        }

        String message = lower(error.getMessage());
        if (isValidationError(error, message)) {
            return classifyValidationError(error, timestamp);
        }

        if (message.contains("auth") || message.contains("token") || message.contains("credential")) {
            return ClassifiedError.builder(ErrorType.AUTHENTICATION)
                .code(401)
                .message(authenticationMessage(message))
                .retryable(false)
                .timestamp(timestamp)
                .cause(error)
                .build();
        }

        return unknown(error, timestamp);
    }

    private ClassifiedError classifyHttpError(HttpResponseData response, Throwable error, Instant timestamp) {
        int status = response.getStatusCode();
        Map<String, Object> body = parseBody(response.getBody());

        ClassifiedError.Builder builder;
        switch (status) {
            case 400:
                builder = ClassifiedError.builder(ErrorType.VALIDATION)
                    .message(badRequestMessage(body))
                    .retryable(false);
                break;
            case 401:
                builder = ClassifiedError.builder(ErrorType.AUTHENTICATION)
                    .message("Unauthorized - Invalid API credentials or expired token")
                    .retryable(false);
                break;
            case 403:
                builder = ClassifiedError.builder(ErrorType.AUTHENTICATION)
                    .message("Forbidden - Insufficient permissions for this operation")
                    .retryable(false);
                break;
            case 404:
                builder = ClassifiedError.builder(ErrorType.API_ERROR)
                    .message(notFoundMessage(body))
                    .retryable(false);
                break;
            case 429:
                Integer retryAfter = parseRetryAfter(response.firstHeader("retry-after"));
                builder = ClassifiedError.builder(ErrorType.RATE_LIMIT)
                    .message(rateLimitMessage(retryAfter))
                    .retryable(true)
                    .retryAfterSeconds(retryAfter);
                break;
            case 500:
            case 502:
            case 503:
            case 504:
                builder = ClassifiedError.builder(ErrorType.API_ERROR)
                    .message(serverErrorMessage(status))
                    .retryable(true);
                break;
            default:
                Object remoteMessage = body.get("message");
                builder = ClassifiedError.builder(ErrorType.API_ERROR)
                    .message("HTTP " + status + ": " + (remoteMessage != null ? remoteMessage : "Unknown API error"))
                    .retryable(status >= 500);
        }

        return builder
            .code(status)
            .details(body)
            .timestamp(timestamp)
            .cause(error)
            .build();
    }

    private ClassifiedError classifyNetworkError(Throwable error, NetworkErrorCode networkCode, String operation,
                                                 Instant timestamp) {
        TransportException transport = error instanceof TransportException ? (TransportException) error : null;
        String rawCode = transport != null && transport.getErrorCode() != null ? transport.getErrorCode() : networkCode.getCode();

        ClassifiedError.Builder builder = ClassifiedError.builder(ErrorType.NETWORK)
            .code(0)
            .retryable(networkCode.isRetryable())
            .detail("operationName", operation)
            .detail("errorCode", rawCode)
            .timestamp(timestamp)
            .cause(error);

        switch (networkCode) {
            case TIMED_OUT:
                Long timeoutMs = error instanceof AttemptTimeoutException ? ((AttemptTimeoutException) error).getTimeoutMs() : null;
                builder.code(408)
                    .detail("timeoutMs", timeoutMs)
                    .message(timeoutMs != null
                        ? "Network timeout during " + operation + " - Operation exceeded " + timeoutMs + "ms limit"
                        : "Network timeout during " + operation + " - The remote API did not respond in time");
                break;
            case CONNECTION_REFUSED:
                builder.detail("host", transport != null ? transport.getHost() : null)
                    .detail("port", transport != null ? transport.getPort() : null)
                    .message("Connection refused during " + operation + " - Unable to connect to the remote API server");
                break;
            case DNS_NOT_FOUND:
                builder.detail("hostname", transport != null ? transport.getHost() : error.getMessage())
                    .message("DNS resolution failed during " + operation + " - Cannot resolve the remote API hostname");
                break;
            case NETWORK_UNREACHABLE:
                builder.message("Network unreachable during " + operation + " - Cannot reach the remote API server");
                break;
            case CONNECTION_RESET:
                builder.message("Connection reset during " + operation + " - Server closed the connection unexpectedly");
                break;
            case CONNECTION_ABORTED:
                builder.message("Connection aborted during " + operation + " - Socket connection was terminated");
                break;
            case CERTIFICATE:
                builder.detail("reason", error.getMessage())
                    .message("SSL/TLS error during " + operation + " - Certificate validation failed");
                break;
            default:
                builder.detail("originalMessage", error.getMessage())
                    .message("Network error during " + operation + ": "
                        + (error.getMessage() != null ? error.getMessage() : "Unknown network error"));
        }
        return builder.build();
    }

    private NetworkErrorCode resolveNetworkCode(Throwable error, int depth) {
        if (error instanceof TransportException) {
            return ((TransportException) error).getNetworkErrorCode();
        }
        if (error instanceof SSLException || error instanceof CertificateException) {
            return NetworkErrorCode.CERTIFICATE;
        }
        if (error instanceof UnknownHostException) {
            return NetworkErrorCode.DNS_NOT_FOUND;
        }
        if (error instanceof HttpTimeoutException || error instanceof SocketTimeoutException
            || error instanceof TimeoutException) {
            return NetworkErrorCode.TIMED_OUT;
        }
        if (error instanceof ConnectException) {
            return NetworkErrorCode.CONNECTION_REFUSED;
        }
        if (error instanceof NoRouteToHostException) {
            return NetworkErrorCode.NETWORK_UNREACHABLE;
        }

        String message = lower(error.getMessage());
        if (error instanceof SocketException) {
            if (message.contains("reset")) {
                return NetworkErrorCode.CONNECTION_RESET;
            }
            if (message.contains("abort") || message.contains("broken pipe") || message.contains("socket hang up")) {
                return NetworkErrorCode.CONNECTION_ABORTED;
            }
            if (message.contains("refused")) {
                return NetworkErrorCode.CONNECTION_REFUSED;
            }
            return NetworkErrorCode.OTHER;
        }
        if (error.getClass().getSimpleName().contains("Timeout")
            || message.contains("timeout") || message.contains("timed out")) {
            return NetworkErrorCode.TIMED_OUT;
        }
        if (message.contains("socket hang up")) {
            return NetworkErrorCode.CONNECTION_ABORTED;
        }
        if (message.contains("certificate")) {
            return NetworkErrorCode.CERTIFICATE;
        }

        // HttpClient and friends wrap socket failures in plain IOExceptions
        Throwable cause = error.getCause();
        if (error instanceof IOException && cause != null && cause != error && depth < MAX_CAUSE_DEPTH) {
            return resolveNetworkCode(cause, depth + 1);
        }
        return null;
    }

    private ClassifiedError classifyValidationError(Throwable error, Instant timestamp) {
        Map<String, String> fieldErrors = fieldErrors(error);
        return ClassifiedError.builder(ErrorType.VALIDATION)
            .code(400)
            .message(validationMessage(error, fieldErrors))
            .retryable(false)
            .details(fieldErrors)
            .timestamp(timestamp)
            .cause(error)
            .build();
    }

    private static boolean isTypedValidationError(Throwable error) {
        return error instanceof RequestValidationException || error instanceof ConstraintViolationException;
    }

    private boolean isValidationError(Throwable error, String message) {
        return isTypedValidationError(error)
            || "ValidationException".equals(error.getClass().getSimpleName())
            || message.contains("validation");
    }

    private Map<String, String> fieldErrors(Throwable error) {
        if (error instanceof RequestValidationException) {
            return ((RequestValidationException) error).getFieldErrors();
        }
        if (error instanceof ConstraintViolationException) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (ConstraintViolation<?> violation : ((ConstraintViolationException) error).getConstraintViolations()) {
                fields.put(String.valueOf(violation.getPropertyPath()), violation.getMessage());
            }
            return fields;
        }
        return Collections.emptyMap();
    }

    private String validationMessage(Throwable error, Map<String, String> fieldErrors) {
        if (!fieldErrors.isEmpty()) {
            return "Validation failed - " + fieldErrors.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
        }
        return "Validation error: " + (error.getMessage() != null ? error.getMessage() : "Invalid input data");
    }

    private String authenticationMessage(String message) {
        if (message.contains("token")) {
            return "Authentication failed - Invalid or expired access token";
        }
        if (message.contains("credential")) {
            return "Authentication failed - Invalid credentials provided";
        }
        return "Authentication failed - Please check your API credentials";
    }

    private String badRequestMessage(Map<String, Object> body) {
        Object errors = body.get("errors");
        if (errors == null) {
            return "Bad request - Invalid parameters or request format";
        }
        try {
            return "Bad request: " + objectMapper.writeValueAsString(errors);
        } catch (JsonProcessingException ex) {
            return "Bad request: " + errors;
        }
    }

    private String notFoundMessage(Map<String, Object> body) {
        Object remoteMessage = body.get("message");
        if (remoteMessage != null && !remoteMessage.toString().isBlank()) {
            return "Resource not found - " + remoteMessage;
        }
        return "Resource not found - The requested resource does not exist";
    }

    private String rateLimitMessage(Integer retryAfter) {
        String base = "Rate limit exceeded - Too many requests to the remote API";
        if (retryAfter != null) {
            return base + ". Retry after " + retryAfter + " seconds";
        }
        return base + ". Please wait before making more requests";
    }

    private String serverErrorMessage(int status) {
        switch (status) {
            case 500:
                return "Internal server error - The remote API is experiencing issues";
            case 502:
                return "Bad gateway - The remote API gateway returned an error";
            case 503:
                return "Service unavailable - The remote API is temporarily unavailable";
            case 504:
                return "Gateway timeout - The remote API did not respond in time";
            default:
                return "Server error (" + status + ") - The remote API returned an error";
        }
    }

    private ClassifiedError unknown(Throwable error, Instant timestamp) {
        String message = error != null ? error.getMessage() : null;
        return ClassifiedError.builder(ErrorType.UNKNOWN)
            .code(500)
            .message("Unknown error occurred: " + (message != null && !message.isEmpty() ? message : "No error message available"))
            .retryable(false)
            .detail("originalMessage", message)
            .detail("exceptionType", error != null ? error.getClass().getName() : null)
            .timestamp(timestamp)
            .cause(error)
            .build();
    }

    private Map<String, Object> parseBody(String body) {
        if (body == null || body.isBlank()) {
            return Collections.emptyMap();
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readValue(trimmed, JSON_OBJECT);
            } catch (JsonProcessingException ex) {
                log.debug("Error response body is not valid JSON: {}", ex.getOriginalMessage());
            }
        }
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("body", trimmed.length() > BODY_PREVIEW_CHARS ? trimmed.substring(0, BODY_PREVIEW_CHARS) : trimmed);
        return preview;
    }

    static Integer parseRetryAfter(String header) {
        if (header == null) {
            return null;
        }
        try {
            int seconds = Integer.parseInt(header.trim());
            return seconds >= 0 ? seconds : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static ApiResponseException findApiResponse(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth <= MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ApiResponseException) {
                return (ApiResponseException) current;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

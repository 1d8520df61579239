package com.apiresilience.api;

import com.apiresilience.exception.ApiOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Validation failed");
        body.put("fieldErrors", fieldErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ApiOperationException.class)
    public ResponseEntity<Map<String, Object>> handleOperationFailure(ApiOperationException ex) {
        HttpStatus status = ex.getKind() == ApiOperationException.Kind.CALLER_INPUT
            ? HttpStatus.BAD_REQUEST
            : HttpStatus.BAD_GATEWAY;
        if (status == HttpStatus.BAD_GATEWAY) {
            log.warn("Remote operation failed: {}", ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", ex.getKind());
        body.put("code", ex.getCode());
        body.put("message", ex.getMessage());
        body.put("troubleshooting", ex.getTroubleshooting());
        return ResponseEntity.status(status).body(body);
    }
}

package com.warden.dispatch.api;

import com.warden.core.policy.PolicyConfigurationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new HashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return buildResponse(400, "VALIDATION_ERROR", "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(400, "BAD_REQUEST", "Malformed request body", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return buildResponse(400, "BAD_REQUEST", "Invalid value for " + ex.getName(), null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Client error: {}", ex.getMessage());
        return buildResponse(400, "BAD_REQUEST", ex.getMessage(), null, request);
    }

    @ExceptionHandler(PolicyConfigurationException.class)
    public ResponseEntity<ApiError> handlePolicy(PolicyConfigurationException ex, HttpServletRequest request) {
        log.warn("Policy rejected: {}", ex.getMessage());
        return buildResponse(422, "POLICY_REJECTED", ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error", ex);
        return buildResponse(500, "INTERNAL_ERROR", "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiError> buildResponse(int status, String error, String message,
                                                   Map<String, Object> details, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ApiError.of(error, message, details, request.getRequestURI()));
    }
}

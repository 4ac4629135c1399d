package com.warden.dispatch.api;

import java.time.Instant;
import java.util.Map;

public record ApiError(
    String error,
    String message,
    Map<String, Object> details,
    String path,
    Instant timestamp
) {
    public static ApiError of(String error, String message, Map<String, Object> details, String path) {
        return new ApiError(error, message, details == null ? Map.of() : details, path, Instant.now());
    }
}

package com.ecgheartbeat.backend.dto;

import java.util.LinkedHashMap;

/**
 * Success envelope: {@code {success: true, message, ...}} with endpoint-specific fields appended in order.
 */
public class ApiResponse extends LinkedHashMap<String, Object> {

    private ApiResponse(String message) {
        put("success", true);
        put("message", message);
    }

    public static ApiResponse success(String message) {
        return new ApiResponse(message);
    }

    public ApiResponse with(String key, Object value) {
        put(key, value);
        return this;
    }
}

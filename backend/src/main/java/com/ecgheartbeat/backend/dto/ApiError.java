package com.ecgheartbeat.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    private boolean success;
    private String message;
    private String path;
    private String debug;

    public static ApiError of(String message) {
        return new ApiError(false, message, null, null);
    }

    public static ApiError withDebug(String message, String debug) {
        return new ApiError(false, message, null, debug);
    }

    public static ApiError forPath(String message, String path) {
        return new ApiError(false, message, path, null);
    }
}

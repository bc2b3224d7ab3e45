package com.ecgheartbeat.backend.exception;

import org.springframework.http.HttpStatus;

public class StorageUnavailableException extends BizException {

    public static final String NOT_CONFIGURED = "DATABASE_NOT_CONFIGURED";
    public static final String UNAVAILABLE = "DATABASE_UNAVAILABLE";

    private StorageUnavailableException(String code, String message) {
        super(code, message);
    }

    private StorageUnavailableException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static StorageUnavailableException notConfigured() {
        return new StorageUnavailableException(NOT_CONFIGURED, "Database not configured");
    }

    public static StorageUnavailableException unavailable(Throwable cause) {
        return new StorageUnavailableException(UNAVAILABLE, "Database connection failed", cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}

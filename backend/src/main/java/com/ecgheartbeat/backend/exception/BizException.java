package com.ecgheartbeat.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures the API reports with a known status and message.
 */
public abstract class BizException extends RuntimeException {
    private final String code;

    protected BizException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected BizException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public abstract HttpStatus getStatus();
}

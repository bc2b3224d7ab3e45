package com.ecgheartbeat.backend.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends BizException {

    public ValidationException(String message) {
        this("VALIDATION_ERROR", message);
    }

    public ValidationException(String code, String message) {
        super(code, message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}

package com.ecgheartbeat.backend.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends BizException {

    public ConflictException(String code, String message) {
        super(code, message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}

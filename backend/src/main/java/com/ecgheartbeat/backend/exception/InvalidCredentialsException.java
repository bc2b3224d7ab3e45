package com.ecgheartbeat.backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidCredentialsException extends BizException {

    public InvalidCredentialsException(String message) {
        super("INVALID_CREDENTIALS", message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNAUTHORIZED;
    }
}

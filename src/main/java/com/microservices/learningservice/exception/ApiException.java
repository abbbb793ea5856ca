package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for every error that is expected to reach the request boundary.
 * The status and code are rendered by the global exception handler.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}

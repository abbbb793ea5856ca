package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class TokenExpiredException extends ApiException {

    public TokenExpiredException() {
        this("Token has expired");
    }

    public TokenExpiredException(String message) {
        super(HttpStatus.BAD_REQUEST, "token_expired", message);
    }
}

package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class TokenNotFoundException extends ApiException {

    public TokenNotFoundException() {
        this("Invalid token");
    }

    public TokenNotFoundException(String message) {
        super(HttpStatus.BAD_REQUEST, "token_not_found", message);
    }
}

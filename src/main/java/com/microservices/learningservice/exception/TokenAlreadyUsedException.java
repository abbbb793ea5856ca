package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class TokenAlreadyUsedException extends ApiException {

    public TokenAlreadyUsedException() {
        this("Token has already been used");
    }

    public TokenAlreadyUsedException(String message) {
        super(HttpStatus.CONFLICT, "token_already_used", message);
    }
}

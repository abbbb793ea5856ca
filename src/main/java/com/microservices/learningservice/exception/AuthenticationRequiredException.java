package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationRequiredException extends ApiException {

    public AuthenticationRequiredException() {
        this("Authentication credentials were not provided");
    }

    public AuthenticationRequiredException(String message) {
        super(HttpStatus.UNAUTHORIZED, "authentication_required", message);
    }
}

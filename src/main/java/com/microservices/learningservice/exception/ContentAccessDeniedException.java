package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class ContentAccessDeniedException extends ApiException {

    public ContentAccessDeniedException() {
        this("Access denied");
    }

    public ContentAccessDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, "access_denied", message);
    }
}

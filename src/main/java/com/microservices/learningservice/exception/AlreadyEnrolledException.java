package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class AlreadyEnrolledException extends ApiException {

    public AlreadyEnrolledException() {
        this("Already enrolled in this course");
    }

    public AlreadyEnrolledException(String message) {
        super(HttpStatus.CONFLICT, "already_enrolled", message);
    }
}

package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class NotEnrolledException extends ApiException {

    public NotEnrolledException() {
        this("You are not enrolled in this course");
    }

    public NotEnrolledException(String message) {
        super(HttpStatus.FORBIDDEN, "not_enrolled", message);
    }
}

package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class DuplicateReviewException extends ApiException {

    public DuplicateReviewException() {
        this("You have already reviewed this course");
    }

    public DuplicateReviewException(String message) {
        super(HttpStatus.CONFLICT, "duplicate_review", message);
    }
}

package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class CourseFullException extends ApiException {

    public CourseFullException() {
        this("Course is full");
    }

    public CourseFullException(String message) {
        super(HttpStatus.CONFLICT, "course_full", message);
    }
}

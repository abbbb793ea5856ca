package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class NotAStudentException extends ApiException {

    public NotAStudentException() {
        this("Only students can enroll in courses");
    }

    public NotAStudentException(String message) {
        super(HttpStatus.FORBIDDEN, "not_a_student", message);
    }
}

package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

public class PermissionDeniedException extends ApiException {

    public PermissionDeniedException() {
        this("Permission denied");
    }

    public PermissionDeniedException(String message) {
        super(HttpStatus.FORBIDDEN, "permission_denied", message);
    }
}

package com.microservices.learningservice.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Input that passed bean validation but violates a cross-field or lookup rule.
 */
public class InvalidRequestException extends ApiException {

    private final Map<String, String> fieldErrors;

    public InvalidRequestException(String message) {
        this(message, Map.of());
    }

    public InvalidRequestException(String field, String message) {
        this(message, Map.of(field, message));
    }

    public InvalidRequestException(String message, Map<String, String> fieldErrors) {
        super(HttpStatus.BAD_REQUEST, "validation_error", message);
        this.fieldErrors = fieldErrors;
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}

package com.microservices.learningservice.exception;

/**
 * Raised by the mailer when a message could not be handed to the delivery queue.
 * Never mapped to a response: callers log it after their own state change has committed.
 */
public class MailDispatchException extends RuntimeException {

    public MailDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

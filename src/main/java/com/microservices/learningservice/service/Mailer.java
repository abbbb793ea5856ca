package com.microservices.learningservice.service;

/**
 * Outbound mail. Delivery is asynchronous; a returned call only means the message was accepted.
 */
public interface Mailer {

    /**
     * @throws com.microservices.learningservice.exception.MailDispatchException if the message could not be accepted
     */
    void send(String to, String subject, String body);
}

package com.microservices.learningservice.service;

import com.microservices.learningservice.config.RabbitMQConfig;
import com.microservices.learningservice.exception.MailDispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Hands mail to the delivery worker through {@link RabbitMQConfig#MAIL_QUEUE}.
 */
@Component
@Slf4j
public class RabbitMailer implements Mailer {

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;
    private final String from;

    public RabbitMailer(RabbitTemplate rabbitTemplate,
                        Clock clock,
                        @Value("${learning.mail.from:no-reply@learning.local}") String from) {
        this.rabbitTemplate = rabbitTemplate;
        this.clock = clock;
        this.from = from;
    }

    @Override
    public void send(String to, String subject, String body) {
        Map<String, Object> message = Map.of(
                "to", to,
                "from", from,
                "subject", subject,
                "body", body,
                "timestamp", LocalDateTime.now(clock).toString()
        );
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.MAIL_QUEUE, message);
            log.info("Queued mail '{}' for {}", subject, to);
        } catch (AmqpException e) {
            throw new MailDispatchException("Failed to queue mail for " + to, e);
        }
    }
}

package com.microservices.learningservice.service;

import com.microservices.learningservice.config.RabbitMQConfig;
import com.microservices.learningservice.model.Course;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Fire-and-forget domain notifications on {@link RabbitMQConfig#NOTIFICATION_QUEUE}.
 * Inside a transaction the message is held back until commit, so a rolled-back
 * enrollment or review never produces a notification.
 */
@Service
@Slf4j
public class NotificationService {

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    public NotificationService(RabbitTemplate rabbitTemplate, Clock clock) {
        this.rabbitTemplate = rabbitTemplate;
        this.clock = clock;
    }

    public void courseEnrolled(Long studentId, Course course) {
        send(studentId, "You have been enrolled in the course: " + course.getTitle(), "COURSE_ENROLLMENT", course.getId());
        send(course.getTeacher().getId(), "A new student enrolled in your course: " + course.getTitle(),
                "NEW_STUDENT", course.getId());
    }

    public void courseCompleted(Long studentId, Course course) {
        send(studentId, "Congratulations! You completed the course: " + course.getTitle(), "COURSE_COMPLETED", course.getId());
    }

    public void reviewPosted(Course course, int rating) {
        send(course.getTeacher().getId(), "Your course " + course.getTitle() + " received a " + rating + "-star review",
                "NEW_REVIEW", course.getId());
    }

    private void send(Long userId, String message, String type, Long courseId) {
        Map<String, Object> notification = Map.of(
                "userId", userId,
                "message", message,
                "type", type,
                "courseId", courseId,
                "timestamp", LocalDateTime.now(clock).toString()
        );
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(notification, type, userId);
                }
            });
            return;
        }
        publish(notification, type, userId);
    }

    private void publish(Map<String, Object> notification, String type, Long userId) {
        try {
            rabbitTemplate.convertAndSend(RabbitMQConfig.NOTIFICATION_QUEUE, notification);
            log.info("Sent {} notification to user: {}", type, userId);
        } catch (Exception e) {
            log.error("Failed to send {} notification to user: {}", type, userId, e);
        }
    }
}

package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.LessonProgressRequest;
import com.microservices.learningservice.dto.LessonProgressResponse;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.NotEnrolledException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseEnrollment;
import com.microservices.learningservice.model.CourseEnrollment.EnrollmentStatus;
import com.microservices.learningservice.model.Lesson;
import com.microservices.learningservice.model.LessonProgress;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.LessonProgressRepository;
import com.microservices.learningservice.repository.LessonRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.AccessPolicy;
import com.microservices.learningservice.security.Action;
import com.microservices.learningservice.security.Actor;
import com.microservices.learningservice.security.ContentNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Lesson progress and the course percentage derived from it.
 * <p>
 * Course progress is recomputed on every write as completed lessons over current lessons.
 * It is not a ratchet: adding lessons lowers it. Completion of the enrollment is one-way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LessonRepository lessonRepository;
    private final LessonProgressRepository progressRepository;
    private final CourseEnrollmentRepository enrollmentRepository;
    private final UserRepository userRepository;
    private final AccessPolicy accessPolicy;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public LessonProgressResponse recordLessonProgress(Actor actor, Long lessonId, LessonProgressRequest request) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        Long studentId = actor.getUserId();
        Lesson lesson = lessonRepository.findById(lessonId)
                .orElseThrow(() -> ResourceNotFoundException.of("Lesson", lessonId));
        Course course = lesson.getCourse();
        CourseEnrollment enrollment = enrollmentRepository
                .findByStudentIdAndCourseIdAndActiveTrue(studentId, course.getId())
                .orElseThrow(() -> new NotEnrolledException("You must be enrolled in this course to track progress"));
        accessPolicy.check(actor, ContentNode.of(lesson), Action.READ, true);

        LocalDateTime now = LocalDateTime.now(clock);
        LessonProgress progress = progressRepository.findByStudentIdAndLessonId(studentId, lessonId)
                .orElseGet(() -> new LessonProgress(userRepository.getReferenceById(studentId), lesson, now));

        if (request.getCompletionPercentage() != null) {
            progress.setCompletionPercentage(request.getCompletionPercentage());
        }
        int delta = request.getTimeSpentMinutes() == null ? 0 : Math.max(0, request.getTimeSpentMinutes());
        progress.setTimeSpentMinutes(progress.getTimeSpentMinutes() + delta);
        if (request.isCompleted() && !progress.isCompleted()) {
            progress.setCompleted(true);
            progress.setCompletedAt(now);
            log.info("Student {} completed lesson {}", studentId, lessonId);
        }
        LessonProgress saved = progressRepository.saveAndFlush(progress);

        recomputeCourseProgress(enrollment, now);
        return LessonProgressResponse.from(saved, enrollment.getProgressPercentage());
    }

    /**
     * Recomputes the enrollment percentage. With no lessons in the course it is left unchanged.
     */
    void recomputeCourseProgress(CourseEnrollment enrollment, LocalDateTime now) {
        Long courseId = enrollment.getCourse().getId();
        Long studentId = enrollment.getStudent().getId();
        long total = lessonRepository.countByCourseId(courseId);
        if (total == 0) {
            return;
        }
        long completed = progressRepository.countCompletedInCourse(studentId, courseId);
        BigDecimal percentage = percentage(completed, total);
        enrollment.setProgressPercentage(percentage);

        if (percentage.compareTo(HUNDRED) == 0 && enrollment.getStatus() != EnrollmentStatus.COMPLETED) {
            enrollment.setStatus(EnrollmentStatus.COMPLETED);
            enrollment.setCompletedAt(now);
            log.info("Student {} completed course {}", studentId, courseId);
            notificationService.courseCompleted(studentId, enrollment.getCourse());
        }
        enrollmentRepository.save(enrollment);
    }

    /**
     * completed / total * 100, two decimals, half-up. Exactly 100 only when every lesson is done.
     */
    static BigDecimal percentage(long completed, long total) {
        if (completed >= total) {
            return HUNDRED.setScale(2);
        }
        BigDecimal value = BigDecimal.valueOf(completed)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        // 99.995 and up would round to 100 with lessons still open
        return value.compareTo(HUNDRED) >= 0 ? new BigDecimal("99.99") : value;
    }

    @Transactional(readOnly = true)
    public List<LessonProgressResponse> courseProgress(Actor actor, Long courseId) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        CourseEnrollment enrollment = enrollmentRepository
                .findByStudentIdAndCourseId(actor.getUserId(), courseId)
                .orElseThrow(() -> new NotEnrolledException("You are not enrolled in this course"));
        return progressRepository.findByStudentInCourse(actor.getUserId(), courseId).stream()
                .map(p -> LessonProgressResponse.from(p, enrollment.getProgressPercentage()))
                .toList();
    }
}

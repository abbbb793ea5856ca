package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.EnrollmentResponse;
import com.microservices.learningservice.dto.PageResponse;
import com.microservices.learningservice.exception.AlreadyEnrolledException;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.CourseFullException;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.NotAStudentException;
import com.microservices.learningservice.exception.NotEnrolledException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseEnrollment;
import com.microservices.learningservice.model.CourseEnrollment.EnrollmentStatus;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.CourseRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.Actor;
import com.microservices.learningservice.util.PageableFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Enrollment lifecycle: enrolled, then completed (via progress) or dropped (via unenroll).
 * A dropped enrollment is reactivated on the next enroll, since (student, course) is unique.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    private final CourseEnrollmentRepository enrollmentRepository;
    private final CourseRepository courseRepository;
    private final UserRepository userRepository;
    private final CacheService cacheService;
    private final NotificationService notificationService;
    private final PageableFactory pageableFactory;
    private final Clock clock;

    @Transactional
    public EnrollmentResponse enroll(Actor actor, Long courseId) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        if (!actor.hasRole(RoleName.STUDENT)) {
            throw new NotAStudentException();
        }
        Long studentId = actor.getUserId();
        Course course = courseRepository.findById(courseId)
                .filter(Course::isPublished)
                .orElseThrow(() -> new ResourceNotFoundException("Course not found"));

        Optional<CourseEnrollment> existing = enrollmentRepository.findByStudentIdAndCourseId(studentId, courseId);
        if (existing.isPresent() && existing.get().getStatus() != EnrollmentStatus.DROPPED) {
            throw new AlreadyEnrolledException();
        }
        checkCapacity(course);

        LocalDateTime now = LocalDateTime.now(clock);
        CourseEnrollment enrollment;
        if (existing.isPresent()) {
            enrollment = existing.get();
            enrollment.setActive(true);
            enrollment.setStatus(EnrollmentStatus.ENROLLED);
            enrollment.setEnrolledAt(now);
            log.info("Student {} re-enrolled in course {}", studentId, courseId);
        } else {
            enrollment = new CourseEnrollment(userRepository.getReferenceById(studentId), course, now);
            log.info("Student {} enrolled in course {}", studentId, courseId);
        }
        CourseEnrollment saved = enrollmentRepository.save(enrollment);

        cacheService.recordEnrollment(courseId);
        notificationService.courseEnrolled(studentId, course);
        return EnrollmentResponse.from(saved);
    }

    @Transactional
    public EnrollmentResponse unenroll(Actor actor, Long courseId) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        CourseEnrollment enrollment = enrollmentRepository
                .findByStudentIdAndCourseIdAndActiveTrue(actor.getUserId(), courseId)
                .orElseThrow(() -> new NotEnrolledException("You are not enrolled in this course"));
        // completion is terminal
        if (enrollment.getStatus() == EnrollmentStatus.COMPLETED) {
            throw new InvalidRequestException("A completed course cannot be dropped");
        }
        enrollment.setActive(false);
        enrollment.setStatus(EnrollmentStatus.DROPPED);
        CourseEnrollment saved = enrollmentRepository.save(enrollment);
        log.info("Student {} dropped course {}", actor.getUserId(), courseId);
        return EnrollmentResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public PageResponse<EnrollmentResponse> myEnrollments(Actor actor, Integer page, Integer pageSize) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        return PageResponse.of(
                enrollmentRepository.findByStudentIdAndActiveTrueOrderByEnrolledAtDesc(
                        actor.getUserId(), pageableFactory.of(page, pageSize)),
                EnrollmentResponse::from);
    }

    private void checkCapacity(Course course) {
        Integer max = course.getMaxStudents();
        if (max != null && enrollmentRepository.countByCourseIdAndActiveTrue(course.getId()) >= max) {
            log.warn("Course {} is full ({} students)", course.getId(), max);
            throw new CourseFullException();
        }
    }
}

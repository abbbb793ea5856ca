package com.microservices.learningservice.service;

import com.microservices.learningservice.TestData;
import com.microservices.learningservice.dto.LessonProgressRequest;
import com.microservices.learningservice.dto.LessonProgressResponse;
import com.microservices.learningservice.exception.NotEnrolledException;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseEnrollment;
import com.microservices.learningservice.model.CourseEnrollment.EnrollmentStatus;
import com.microservices.learningservice.model.CourseModule;
import com.microservices.learningservice.model.Lesson;
import com.microservices.learningservice.model.LessonProgress;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.LessonProgressRepository;
import com.microservices.learningservice.repository.LessonRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.AccessPolicy;
import com.microservices.learningservice.security.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final LocalDateTime NOW_LOCAL = LocalDateTime.of(2024, 3, 1, 10, 0);

    @Mock
    private LessonRepository lessonRepository;
    @Mock
    private LessonProgressRepository progressRepository;
    @Mock
    private CourseEnrollmentRepository enrollmentRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private NotificationService notificationService;

    private ProgressService progressService;

    private final User studentUser = TestData.user(5L, "student@example.com");
    private final Actor student = Actor.authenticated(5L, RoleName.STUDENT, false);
    private Course course;
    private Lesson lesson;
    private CourseEnrollment enrollment;

    @BeforeEach
    void setUp() {
        progressService = new ProgressService(lessonRepository, progressRepository, enrollmentRepository,
                userRepository, new AccessPolicy(), notificationService, Clock.fixed(NOW, ZoneOffset.UTC));
        course = TestData.course(10L, TestData.user(1L, "teacher@example.com"), true);
        CourseModule module = TestData.module(20L, course, 1, true);
        lesson = TestData.lesson(100L, module, 1, true);
        enrollment = TestData.enrollment(3L, studentUser, course);
    }

    private void stubLessonAndEnrollment() {
        when(lessonRepository.findById(100L)).thenReturn(Optional.of(lesson));
        when(enrollmentRepository.findByStudentIdAndCourseIdAndActiveTrue(5L, 10L)).thenReturn(Optional.of(enrollment));
        when(progressRepository.saveAndFlush(any(LessonProgress.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private LessonProgress existingProgress() {
        LessonProgress progress = new LessonProgress(studentUser, lesson, NOW_LOCAL.minusDays(1));
        progress.setId(50L);
        return progress;
    }

    @Test
    void completingOneOfFourLessonsGivesQuarterProgress() {
        stubLessonAndEnrollment();
        when(progressRepository.findByStudentIdAndLessonId(5L, 100L)).thenReturn(Optional.empty());
        when(userRepository.getReferenceById(5L)).thenReturn(studentUser);
        when(lessonRepository.countByCourseId(10L)).thenReturn(4L);
        when(progressRepository.countCompletedInCourse(5L, 10L)).thenReturn(1L);

        LessonProgressResponse response = progressService.recordLessonProgress(student, 100L,
                new LessonProgressRequest(new BigDecimal("100"), 12, true));

        assertThat(response.isCompleted()).isTrue();
        assertThat(response.getCompletedAt()).isEqualTo(NOW_LOCAL);
        assertThat(response.getTimeSpentMinutes()).isEqualTo(12);
        assertThat(response.getCourseProgressPercentage()).isEqualByComparingTo("25.00");
        assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.ENROLLED);
        verify(enrollmentRepository).save(enrollment);
    }

    @Test
    void completingLastLessonCompletesEnrollment() {
        stubLessonAndEnrollment();
        when(progressRepository.findByStudentIdAndLessonId(5L, 100L)).thenReturn(Optional.of(existingProgress()));
        when(lessonRepository.countByCourseId(10L)).thenReturn(3L);
        when(progressRepository.countCompletedInCourse(5L, 10L)).thenReturn(3L);

        progressService.recordLessonProgress(student, 100L, new LessonProgressRequest(null, 0, true));

        assertThat(enrollment.getProgressPercentage()).isEqualByComparingTo("100");
        assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
        assertThat(enrollment.getCompletedAt()).isEqualTo(NOW_LOCAL);
        verify(notificationService).courseCompleted(5L, course);
    }

    @Test
    void completionIsNotReversedWhenProgressDrops() {
        enrollment.setStatus(EnrollmentStatus.COMPLETED);
        enrollment.setCompletedAt(NOW_LOCAL.minusDays(3));
        stubLessonAndEnrollment();
        when(progressRepository.findByStudentIdAndLessonId(5L, 100L)).thenReturn(Optional.of(existingProgress()));
        when(lessonRepository.countByCourseId(10L)).thenReturn(4L);
        when(progressRepository.countCompletedInCourse(5L, 10L)).thenReturn(3L);

        progressService.recordLessonProgress(student, 100L, new LessonProgressRequest(null, 5, false));

        assertThat(enrollment.getProgressPercentage()).isEqualByComparingTo("75.00");
        assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
        assertThat(enrollment.getCompletedAt()).isEqualTo(NOW_LOCAL.minusDays(3));
        verify(notificationService, never()).courseCompleted(any(), any());
    }

    @Test
    void courseWithoutLessonsKeepsProgress() {
        stubLessonAndEnrollment();
        enrollment.setProgressPercentage(new BigDecimal("10.00"));
        when(progressRepository.findByStudentIdAndLessonId(5L, 100L)).thenReturn(Optional.of(existingProgress()));
        when(lessonRepository.countByCourseId(10L)).thenReturn(0L);

        progressService.recordLessonProgress(student, 100L, new LessonProgressRequest(null, 1, true));

        assertThat(enrollment.getProgressPercentage()).isEqualByComparingTo("10.00");
        verify(enrollmentRepository, never()).save(any());
    }

    @Test
    void timeSpentAccumulatesAndPercentageMayDecrease() {
        LessonProgress progress = existingProgress();
        progress.setTimeSpentMinutes(10);
        progress.setCompletionPercentage(new BigDecimal("80"));
        stubLessonAndEnrollment();
        when(progressRepository.findByStudentIdAndLessonId(5L, 100L)).thenReturn(Optional.of(progress));
        when(lessonRepository.countByCourseId(10L)).thenReturn(2L);
        when(progressRepository.countCompletedInCourse(5L, 10L)).thenReturn(0L);

        LessonProgressResponse response = progressService.recordLessonProgress(student, 100L,
                new LessonProgressRequest(new BigDecimal("40"), 5, false));

        assertThat(response.getTimeSpentMinutes()).isEqualTo(15);
        assertThat(response.getCompletionPercentage()).isEqualByComparingTo("40");
        assertThat(response.isCompleted()).isFalse();
    }

    @Test
    void resendingCompletedKeepsOriginalCompletionTime() {
        LessonProgress progress = existingProgress();
        progress.setCompleted(true);
        progress.setCompletedAt(NOW_LOCAL.minusHours(6));
        stubLessonAndEnrollment();
        when(progressRepository.findByStudentIdAndLessonId(5L, 100L)).thenReturn(Optional.of(progress));
        when(lessonRepository.countByCourseId(10L)).thenReturn(2L);
        when(progressRepository.countCompletedInCourse(5L, 10L)).thenReturn(1L);

        LessonProgressResponse response = progressService.recordLessonProgress(student, 100L,
                new LessonProgressRequest(null, 0, true));

        assertThat(response.getCompletedAt()).isEqualTo(NOW_LOCAL.minusHours(6));
        assertThat(response.getCourseProgressPercentage()).isEqualByComparingTo("50.00");
    }

    @Test
    void progressRequiresActiveEnrollment() {
        when(lessonRepository.findById(100L)).thenReturn(Optional.of(lesson));
        when(enrollmentRepository.findByStudentIdAndCourseIdAndActiveTrue(5L, 10L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> progressService.recordLessonProgress(student, 100L,
                new LessonProgressRequest(null, 0, true)))
                .isInstanceOf(NotEnrolledException.class);
    }

    @Test
    void percentageRoundsHalfUpAndReaches100OnlyWhenAllDone() {
        assertThat(ProgressService.percentage(1, 3)).isEqualByComparingTo("33.33");
        assertThat(ProgressService.percentage(2, 3)).isEqualByComparingTo("66.67");
        assertThat(ProgressService.percentage(19999, 20000)).isEqualByComparingTo("99.99");
        assertThat(ProgressService.percentage(7, 7)).isEqualByComparingTo("100");
    }
}

package com.microservices.learningservice.service;

import com.microservices.learningservice.TestData;
import com.microservices.learningservice.dto.LessonRequest;
import com.microservices.learningservice.dto.LessonResponse;
import com.microservices.learningservice.dto.ModuleRequest;
import com.microservices.learningservice.dto.ModuleResponse;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.DuplicateResourceException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseModule;
import com.microservices.learningservice.model.Lesson;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.CourseModuleRepository;
import com.microservices.learningservice.repository.CourseRepository;
import com.microservices.learningservice.repository.LessonProgressRepository;
import com.microservices.learningservice.repository.LessonRepository;
import com.microservices.learningservice.security.AccessPolicy;
import com.microservices.learningservice.security.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CourseContentServiceTest {

    @Mock
    private CourseRepository courseRepository;
    @Mock
    private CourseModuleRepository moduleRepository;
    @Mock
    private LessonRepository lessonRepository;
    @Mock
    private CourseEnrollmentRepository enrollmentRepository;
    @Mock
    private LessonProgressRepository progressRepository;

    private CourseContentService contentService;

    private final Actor owner = Actor.authenticated(1L, RoleName.TEACHER, false);
    private final Actor enrolledStudent = Actor.authenticated(5L, RoleName.STUDENT, false);
    private final Actor stranger = Actor.authenticated(7L, RoleName.STUDENT, false);

    private Course course;
    private CourseModule module;
    private Lesson lesson;
    private Lesson preview;
    private Lesson draftLesson;

    @BeforeEach
    void setUp() {
        contentService = new CourseContentService(courseRepository, moduleRepository, lessonRepository,
                enrollmentRepository, progressRepository, new AccessPolicy());
        course = TestData.course(10L, TestData.user(1L, "teacher@example.com"), true);
        module = TestData.module(20L, course, 1, true);
        lesson = TestData.lesson(30L, module, 1, true);
        preview = TestData.lesson(31L, module, 2, true);
        preview.setFreePreview(true);
        draftLesson = TestData.lesson(32L, module, 3, false);
    }

    private static ModuleRequest moduleRequest(Integer order) {
        ModuleRequest request = new ModuleRequest();
        request.setTitle("Getting started");
        request.setOrder(order);
        return request;
    }

    private static LessonRequest lessonRequest(Integer order) {
        LessonRequest request = new LessonRequest();
        request.setTitle("Variables");
        request.setOrder(order);
        return request;
    }

    @Test
    void newModuleTakesNextFreeOrder() {
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(moduleRepository.findMaxOrderNumber(10L)).thenReturn(3);
        when(moduleRepository.save(any(CourseModule.class))).thenAnswer(inv -> inv.getArgument(0));

        ModuleResponse created = contentService.createModule(owner, 10L, moduleRequest(null));

        assertThat(created.getOrder()).isEqualTo(4);
        assertThat(created.getTitle()).isEqualTo("Getting started");
    }

    @Test
    void firstLessonOfModuleGetsOrderOne() {
        CourseModule empty = TestData.module(21L, course, 2, true);
        when(moduleRepository.findById(21L)).thenReturn(Optional.of(empty));
        when(lessonRepository.findMaxOrderNumber(21L)).thenReturn(null);
        when(lessonRepository.save(any(Lesson.class))).thenAnswer(inv -> inv.getArgument(0));

        LessonResponse created = contentService.createLesson(owner, 21L, lessonRequest(null));

        assertThat(created.getOrder()).isEqualTo(1);
    }

    @Test
    void takenModuleOrderIsConflict() {
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(moduleRepository.existsByCourseIdAndOrderNumber(10L, 1)).thenReturn(true);

        assertThatThrownBy(() -> contentService.createModule(owner, 10L, moduleRequest(1)))
                .isInstanceOf(DuplicateResourceException.class);
        verify(moduleRepository, never()).save(any());
    }

    @Test
    void takenLessonOrderIsConflict() {
        when(moduleRepository.findById(20L)).thenReturn(Optional.of(module));
        when(lessonRepository.existsByModuleIdAndOrderNumber(20L, 2)).thenReturn(true);

        assertThatThrownBy(() -> contentService.createLesson(owner, 20L, lessonRequest(2)))
                .isInstanceOf(DuplicateResourceException.class);
        verify(lessonRepository, never()).save(any());
    }

    @Test
    void onlyOwnerWritesModulesAndLessons() {
        Actor otherTeacher = Actor.authenticated(9L, RoleName.TEACHER, false);
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(moduleRepository.findById(20L)).thenReturn(Optional.of(module));
        when(lessonRepository.findById(30L)).thenReturn(Optional.of(lesson));

        assertThatThrownBy(() -> contentService.createModule(otherTeacher, 10L, moduleRequest(null)))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> contentService.deleteModule(otherTeacher, 20L))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> contentService.updateLesson(otherTeacher, 30L, lessonRequest(5)))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> contentService.createLesson(Actor.ANONYMOUS, 20L, lessonRequest(null)))
                .isInstanceOf(AuthenticationRequiredException.class);
        verify(moduleRepository, never()).save(any());
        verify(moduleRepository, never()).delete(any());
        verify(lessonRepository, never()).save(any());
    }

    @Test
    void lessonBodyIsHiddenFromStudentsWithoutEnrollment() {
        when(lessonRepository.findById(30L)).thenReturn(Optional.of(lesson));
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(7L, 10L)).thenReturn(false);

        LessonResponse response = contentService.getLesson(stranger, 30L);

        assertThat(response.getTitle()).isEqualTo("Lesson 30");
        assertThat(response.getContent()).isNull();
        assertThat(response.getVideoUrl()).isNull();
    }

    @Test
    void enrolledStudentReadsLessonBody() {
        when(lessonRepository.findById(30L)).thenReturn(Optional.of(lesson));
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(5L, 10L)).thenReturn(true);
        when(progressRepository.findByStudentIdAndLessonId(5L, 30L)).thenReturn(Optional.empty());

        LessonResponse response = contentService.getLesson(enrolledStudent, 30L);

        assertThat(response.getContent()).isEqualTo("Body of lesson 30");
        assertThat(response.getVideoUrl()).isEqualTo("https://videos.example.com/30");
        assertThat(response.isCompleted()).isFalse();
    }

    @Test
    void freePreviewIsReadableAnonymously() {
        when(lessonRepository.findById(31L)).thenReturn(Optional.of(preview));

        LessonResponse response = contentService.getLesson(Actor.ANONYMOUS, 31L);

        assertThat(response.getContent()).isEqualTo("Body of lesson 31");
    }

    @Test
    void freePreviewOfUnpublishedCourseRequiresLogin() {
        course.setPublished(false);
        when(lessonRepository.findById(31L)).thenReturn(Optional.of(preview));

        assertThatThrownBy(() -> contentService.getLesson(Actor.ANONYMOUS, 31L))
                .isInstanceOf(AuthenticationRequiredException.class);
    }

    @Test
    void moduleListingHidesDraftLessonsAndStripsBodies() {
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(7L, 10L)).thenReturn(false);
        when(moduleRepository.findByCourseIdOrderByOrderNumber(10L)).thenReturn(List.of(module));
        when(lessonRepository.findByModuleIdOrderByOrderNumber(20L)).thenReturn(List.of(lesson, preview, draftLesson));

        List<ModuleResponse> modules = contentService.listModules(stranger, 10L);

        assertThat(modules).hasSize(1);
        List<LessonResponse> lessons = modules.get(0).getLessons();
        assertThat(lessons).extracting(LessonResponse::getId).containsExactly(30L, 31L);
        assertThat(lessons.get(0).getContent()).isNull();
        assertThat(lessons.get(1).getContent()).isEqualTo("Body of lesson 31");
    }

    @Test
    void unpublishedCourseModulesLookMissing() {
        course.setPublished(false);
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(courseRepository.findById(99L)).thenReturn(Optional.empty());
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(7L, 10L)).thenReturn(false);

        assertThatThrownBy(() -> contentService.listModules(Actor.ANONYMOUS, 10L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Course not found");
        assertThatThrownBy(() -> contentService.listModules(stranger, 10L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Course not found");
        assertThatThrownBy(() -> contentService.listModules(stranger, 99L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Course not found");
    }

    @Test
    void enrolledStudentKeepsAccessAfterCourseIsUnpublished() {
        course.setPublished(false);
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(5L, 10L)).thenReturn(true);

        assertThat(contentService.findVisibleCourse(enrolledStudent, 10L)).isSameAs(course);
    }
}

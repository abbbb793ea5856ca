package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.LessonRequest;
import com.microservices.learningservice.dto.LessonResponse;
import com.microservices.learningservice.dto.ModuleRequest;
import com.microservices.learningservice.dto.ModuleResponse;
import com.microservices.learningservice.exception.DuplicateResourceException;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseModule;
import com.microservices.learningservice.model.Lesson;
import com.microservices.learningservice.model.LessonProgress;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.CourseModuleRepository;
import com.microservices.learningservice.repository.CourseRepository;
import com.microservices.learningservice.repository.LessonProgressRepository;
import com.microservices.learningservice.repository.LessonRepository;
import com.microservices.learningservice.security.AccessPolicy;
import com.microservices.learningservice.security.Action;
import com.microservices.learningservice.security.Actor;
import com.microservices.learningservice.security.ContentNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Modules and lessons of a course. Reads are filtered through {@link AccessPolicy};
 * writes are reserved to the course owner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CourseContentService {

    private final CourseRepository courseRepository;
    private final CourseModuleRepository moduleRepository;
    private final LessonRepository lessonRepository;
    private final CourseEnrollmentRepository enrollmentRepository;
    private final LessonProgressRepository progressRepository;
    private final AccessPolicy accessPolicy;

    @Transactional(readOnly = true)
    public List<ModuleResponse> listModules(Actor actor, Long courseId) {
        Course course = findVisibleCourse(actor, courseId);
        return visibleModules(actor, course, isActivelyEnrolled(actor, courseId));
    }

    /**
     * The course if the actor may see it. Hidden and missing courses are both reported as not found.
     */
    @Transactional(readOnly = true)
    public Course findVisibleCourse(Actor actor, Long courseId) {
        Course course = findCourse(courseId);
        if (!accessPolicy.canRead(actor, ContentNode.of(course), isActivelyEnrolled(actor, courseId))) {
            log.debug("Hiding course {} from user {}", courseId, actor.getUserId());
            throw new ResourceNotFoundException("Course not found");
        }
        return course;
    }

    /**
     * Modules and lessons of {@code course} the actor may see, lesson bodies stripped where not allowed.
     */
    @Transactional(readOnly = true)
    public List<ModuleResponse> visibleModules(Actor actor, Course course, boolean enrolled) {
        Set<Long> completed = completedLessonIds(actor, course.getId(), enrolled);
        return moduleRepository.findByCourseIdOrderByOrderNumber(course.getId()).stream()
                .filter(m -> accessPolicy.canRead(actor, ContentNode.of(m), enrolled))
                .map(m -> ModuleResponse.from(m, visibleLessons(actor, m, enrolled, completed)))
                .toList();
    }

    @Transactional
    public ModuleResponse createModule(Actor actor, Long courseId, ModuleRequest request) {
        Course course = findCourse(courseId);
        accessPolicy.checkWrite(actor, ContentNode.of(course));
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new InvalidRequestException("title", "Title is required");
        }

        Integer order = request.getOrder();
        if (order == null) {
            Integer max = moduleRepository.findMaxOrderNumber(courseId);
            order = max == null ? 1 : max + 1;
        } else if (moduleRepository.existsByCourseIdAndOrderNumber(courseId, order)) {
            throw new DuplicateResourceException("A module with order " + order + " already exists in this course");
        }

        CourseModule module = new CourseModule();
        module.setCourse(course);
        module.setTitle(request.getTitle().trim());
        module.setDescription(request.getDescription());
        module.setOrderNumber(order);
        if (request.getPublished() != null) {
            module.setPublished(request.getPublished());
        }
        course.getModules().add(module);
        CourseModule saved = moduleRepository.save(module);
        log.info("Module {} created in course {}", saved.getId(), courseId);
        return ModuleResponse.from(saved, List.of());
    }

    @Transactional(readOnly = true)
    public ModuleResponse getModule(Actor actor, Long moduleId) {
        CourseModule module = findModule(moduleId);
        Long courseId = module.getCourse().getId();
        boolean enrolled = isActivelyEnrolled(actor, courseId);
        accessPolicy.check(actor, ContentNode.of(module), Action.READ, enrolled);
        Set<Long> completed = completedLessonIds(actor, courseId, enrolled);
        return ModuleResponse.from(module, visibleLessons(actor, module, enrolled, completed));
    }

    @Transactional
    public ModuleResponse updateModule(Actor actor, Long moduleId, ModuleRequest request) {
        CourseModule module = findModule(moduleId);
        accessPolicy.checkWrite(actor, ContentNode.of(module));
        if (request.getTitle() != null) {
            if (request.getTitle().isBlank()) {
                throw new InvalidRequestException("title", "Title must not be blank");
            }
            module.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            module.setDescription(request.getDescription());
        }
        if (request.getOrder() != null && !request.getOrder().equals(module.getOrderNumber())) {
            if (moduleRepository.existsByCourseIdAndOrderNumber(module.getCourse().getId(), request.getOrder())) {
                throw new DuplicateResourceException("A module with order " + request.getOrder() + " already exists in this course");
            }
            module.setOrderNumber(request.getOrder());
        }
        if (request.getPublished() != null) {
            module.setPublished(request.getPublished());
        }
        CourseModule saved = moduleRepository.save(module);
        return ModuleResponse.from(saved, visibleLessons(actor, saved, false, Set.of()));
    }

    @Transactional
    public void deleteModule(Actor actor, Long moduleId) {
        CourseModule module = findModule(moduleId);
        accessPolicy.checkWrite(actor, ContentNode.of(module));
        module.getCourse().getModules().remove(module);
        moduleRepository.delete(module);
        log.info("Module {} deleted", moduleId);
    }

    @Transactional(readOnly = true)
    public List<LessonResponse> listLessons(Actor actor, Long moduleId) {
        CourseModule module = findModule(moduleId);
        Long courseId = module.getCourse().getId();
        boolean enrolled = isActivelyEnrolled(actor, courseId);
        accessPolicy.check(actor, ContentNode.of(module), Action.READ, enrolled);
        return visibleLessons(actor, module, enrolled, completedLessonIds(actor, courseId, enrolled));
    }

    @Transactional
    public LessonResponse createLesson(Actor actor, Long moduleId, LessonRequest request) {
        CourseModule module = findModule(moduleId);
        accessPolicy.checkWrite(actor, ContentNode.of(module));
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            throw new InvalidRequestException("title", "Title is required");
        }

        Integer order = request.getOrder();
        if (order == null) {
            Integer max = lessonRepository.findMaxOrderNumber(moduleId);
            order = max == null ? 1 : max + 1;
        } else if (lessonRepository.existsByModuleIdAndOrderNumber(moduleId, order)) {
            throw new DuplicateResourceException("A lesson with order " + order + " already exists in this module");
        }

        Lesson lesson = new Lesson();
        lesson.setModule(module);
        lesson.setTitle(request.getTitle().trim());
        lesson.setOrderNumber(order);
        applyLessonFields(lesson, request);
        module.getLessons().add(lesson);
        Lesson saved = lessonRepository.save(lesson);
        log.info("Lesson {} created in module {}", saved.getId(), moduleId);
        return LessonResponse.from(saved, true, false);
    }

    @Transactional(readOnly = true)
    public LessonResponse getLesson(Actor actor, Long lessonId) {
        Lesson lesson = findLesson(lessonId);
        Long courseId = lesson.getCourse().getId();
        boolean enrolled = isActivelyEnrolled(actor, courseId);
        ContentNode node = ContentNode.of(lesson);
        accessPolicy.check(actor, node, Action.READ, enrolled);
        boolean completed = enrolled && progressRepository.findByStudentIdAndLessonId(actor.getUserId(), lessonId)
                .map(LessonProgress::isCompleted)
                .orElse(false);
        return LessonResponse.from(lesson, accessPolicy.canReadLessonContent(actor, node, enrolled), completed);
    }

    @Transactional
    public LessonResponse updateLesson(Actor actor, Long lessonId, LessonRequest request) {
        Lesson lesson = findLesson(lessonId);
        accessPolicy.checkWrite(actor, ContentNode.of(lesson));
        if (request.getTitle() != null) {
            if (request.getTitle().isBlank()) {
                throw new InvalidRequestException("title", "Title must not be blank");
            }
            lesson.setTitle(request.getTitle().trim());
        }
        if (request.getOrder() != null && !request.getOrder().equals(lesson.getOrderNumber())) {
            if (lessonRepository.existsByModuleIdAndOrderNumber(lesson.getModule().getId(), request.getOrder())) {
                throw new DuplicateResourceException("A lesson with order " + request.getOrder() + " already exists in this module");
            }
            lesson.setOrderNumber(request.getOrder());
        }
        applyLessonFields(lesson, request);
        return LessonResponse.from(lessonRepository.save(lesson), true, false);
    }

    @Transactional
    public void deleteLesson(Actor actor, Long lessonId) {
        Lesson lesson = findLesson(lessonId);
        accessPolicy.checkWrite(actor, ContentNode.of(lesson));
        lesson.getModule().getLessons().remove(lesson);
        lessonRepository.delete(lesson);
        log.info("Lesson {} deleted", lessonId);
    }

    boolean isActivelyEnrolled(Actor actor, Long courseId) {
        return !actor.isAnonymous()
                && enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(actor.getUserId(), courseId);
    }

    private List<LessonResponse> visibleLessons(Actor actor, CourseModule module, boolean enrolled, Set<Long> completed) {
        return lessonRepository.findByModuleIdOrderByOrderNumber(module.getId()).stream()
                .filter(l -> accessPolicy.canRead(actor, ContentNode.of(l), enrolled))
                .map(l -> LessonResponse.from(l,
                        accessPolicy.canReadLessonContent(actor, ContentNode.of(l), enrolled),
                        completed.contains(l.getId())))
                .toList();
    }

    private Set<Long> completedLessonIds(Actor actor, Long courseId, boolean enrolled) {
        if (!enrolled) {
            return Set.of();
        }
        return new HashSet<>(progressRepository.findCompletedLessonIds(actor.getUserId(), courseId));
    }

    private static void applyLessonFields(Lesson lesson, LessonRequest request) {
        if (request.getDescription() != null) {
            lesson.setDescription(request.getDescription());
        }
        if (request.getLessonType() != null) {
            lesson.setLessonType(request.getLessonType());
        }
        if (request.getContent() != null) {
            lesson.setContent(request.getContent());
        }
        if (request.getVideoUrl() != null) {
            lesson.setVideoUrl(request.getVideoUrl());
        }
        if (request.getDurationMinutes() != null) {
            lesson.setDurationMinutes(request.getDurationMinutes());
        }
        if (request.getPublished() != null) {
            lesson.setPublished(request.getPublished());
        }
        if (request.getFreePreview() != null) {
            lesson.setFreePreview(request.getFreePreview());
        }
    }

    private Course findCourse(Long courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> new ResourceNotFoundException("Course not found"));
    }

    private CourseModule findModule(Long moduleId) {
        return moduleRepository.findById(moduleId)
                .orElseThrow(() -> ResourceNotFoundException.of("Module", moduleId));
    }

    private Lesson findLesson(Long lessonId) {
        return lessonRepository.findById(lessonId)
                .orElseThrow(() -> ResourceNotFoundException.of("Lesson", lessonId));
    }
}

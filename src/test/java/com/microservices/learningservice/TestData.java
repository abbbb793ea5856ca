package com.microservices.learningservice;

import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseEnrollment;
import com.microservices.learningservice.model.CourseModule;
import com.microservices.learningservice.model.Lesson;
import com.microservices.learningservice.model.User;

import java.time.LocalDateTime;

/**
 * Detached entity graphs for unit tests.
 */
public final class TestData {

    private TestData() {
    }

    public static User user(Long id, String email) {
        User user = new User(email, "hash");
        user.setId(id);
        user.setDateJoined(LocalDateTime.of(2024, 1, 1, 0, 0));
        return user;
    }

    public static Course course(Long id, User teacher, boolean published) {
        Course course = new Course();
        course.setId(id);
        course.setTitle("Course " + id);
        course.setSlug("course-" + id);
        course.setDescription("Description");
        course.setTeacher(teacher);
        course.setPublished(published);
        return course;
    }

    public static CourseModule module(Long id, Course course, int order, boolean published) {
        CourseModule module = new CourseModule();
        module.setId(id);
        module.setCourse(course);
        module.setTitle("Module " + id);
        module.setOrderNumber(order);
        module.setPublished(published);
        course.getModules().add(module);
        return module;
    }

    public static Lesson lesson(Long id, CourseModule module, int order, boolean published) {
        Lesson lesson = new Lesson();
        lesson.setId(id);
        lesson.setModule(module);
        lesson.setTitle("Lesson " + id);
        lesson.setOrderNumber(order);
        lesson.setPublished(published);
        lesson.setContent("Body of lesson " + id);
        lesson.setVideoUrl("https://videos.example.com/" + id);
        module.getLessons().add(lesson);
        return lesson;
    }

    public static CourseEnrollment enrollment(Long id, User student, Course course) {
        CourseEnrollment enrollment = new CourseEnrollment(student, course, LocalDateTime.of(2024, 1, 2, 0, 0));
        enrollment.setId(id);
        return enrollment;
    }
}

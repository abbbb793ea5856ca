package com.microservices.learningservice.security;

import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseModule;
import com.microservices.learningservice.model.Lesson;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Publish state of one node of the course tree together with its ancestors.
 * Module and lesson flags are null when the node sits above that level.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ContentNode {

    Long courseId;
    Long ownerId;
    boolean coursePublished;
    Boolean modulePublished;
    Boolean lessonPublished;
    boolean freePreview;

    public static ContentNode of(Course course) {
        return new ContentNode(course.getId(), course.getTeacher().getId(), course.isPublished(), null, null, false);
    }

    public static ContentNode of(CourseModule module) {
        Course course = module.getCourse();
        return new ContentNode(course.getId(), course.getTeacher().getId(), course.isPublished(),
                module.isPublished(), null, false);
    }

    public static ContentNode of(Lesson lesson) {
        CourseModule module = lesson.getModule();
        Course course = module.getCourse();
        return new ContentNode(course.getId(), course.getTeacher().getId(), course.isPublished(),
                module.isPublished(), lesson.isPublished(), lesson.isFreePreview());
    }

    public static ContentNode of(Long courseId, Long ownerId, boolean coursePublished,
                                 Boolean modulePublished, Boolean lessonPublished, boolean freePreview) {
        return new ContentNode(courseId, ownerId, coursePublished, modulePublished, lessonPublished, freePreview);
    }

    /** The node and every ancestor are published. */
    public boolean isFullyPublished() {
        return coursePublished && descendantsPublished();
    }

    /** Module and lesson flags only; the course flag is not consulted. */
    public boolean descendantsPublished() {
        return !Boolean.FALSE.equals(modulePublished) && !Boolean.FALSE.equals(lessonPublished);
    }

    public boolean isOwnedBy(Actor actor) {
        return !actor.isAnonymous() && actor.getUserId().equals(ownerId);
    }
}

package com.microservices.learningservice.security;

import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.ContentAccessDeniedException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import org.springframework.stereotype.Component;

/**
 * Visibility and write rules for the course tree (course, module, lesson).
 * <p>
 * Pure decision logic: callers look up whether the actor holds an active
 * enrollment in the node's course and pass it in.
 * <ol>
 *   <li>Anonymous callers may only read fully published content.</li>
 *   <li>The owning teacher may do anything with their own course tree.</li>
 *   <li>Other authenticated callers may read fully published content.</li>
 *   <li>Active enrollees may read content whose module and lesson are published,
 *       even if the course itself has since been unpublished.</li>
 * </ol>
 * Writes by anyone but the owner are rejected.
 */
@Component
public class AccessPolicy {

    public boolean canRead(Actor actor, ContentNode node, boolean activeEnrollment) {
        if (node.isOwnedBy(actor)) {
            return true;
        }
        if (node.isFullyPublished()) {
            return true;
        }
        return !actor.isAnonymous() && activeEnrollment && node.descendantsPublished();
    }

    /**
     * Lesson body (text, video) is readable by the owner, by active enrollees, and by
     * anyone when the lesson is a free preview of fully published content.
     */
    public boolean canReadLessonContent(Actor actor, ContentNode node, boolean activeEnrollment) {
        if (node.isOwnedBy(actor)) {
            return true;
        }
        if (!actor.isAnonymous() && activeEnrollment && node.descendantsPublished()) {
            return true;
        }
        return node.isFreePreview() && node.isFullyPublished();
    }

    public void check(Actor actor, ContentNode node, Action action, boolean activeEnrollment) {
        if (action.isWrite()) {
            checkWrite(actor, node);
            return;
        }
        if (canRead(actor, node, activeEnrollment)) {
            return;
        }
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        throw new ContentAccessDeniedException();
    }

    public void checkWrite(Actor actor, ContentNode node) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        if (!node.isOwnedBy(actor)) {
            throw new PermissionDeniedException("Only the course teacher can modify this course");
        }
    }
}

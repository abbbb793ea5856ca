package com.microservices.learningservice.security;

import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.ContentAccessDeniedException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import com.microservices.learningservice.model.RoleName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private static final Long OWNER_ID = 1L;

    private final AccessPolicy policy = new AccessPolicy();

    private final Actor owner = Actor.authenticated(OWNER_ID, RoleName.TEACHER, false);
    private final Actor student = Actor.authenticated(2L, RoleName.STUDENT, false);
    private final Actor anonymous = Actor.ANONYMOUS;

    private static ContentNode lesson(boolean course, boolean module, boolean lesson, boolean freePreview) {
        return ContentNode.of(10L, OWNER_ID, course, module, lesson, freePreview);
    }

    @Test
    void anonymousReadsOnlyFullyPublishedContent() {
        assertThat(policy.canRead(anonymous, lesson(true, true, true, false), false)).isTrue();
        assertThat(policy.canRead(anonymous, lesson(false, true, true, false), false)).isFalse();
        assertThat(policy.canRead(anonymous, lesson(true, false, true, false), false)).isFalse();
        assertThat(policy.canRead(anonymous, lesson(true, true, false, false), false)).isFalse();
    }

    @Test
    void anonymousReadOfHiddenContentRequiresAuthentication() {
        assertThatThrownBy(() -> policy.check(anonymous, lesson(false, true, true, false), Action.READ, false))
                .isInstanceOf(AuthenticationRequiredException.class);
    }

    @Test
    void ownerSeesUnpublishedTree() {
        assertThat(policy.canRead(owner, lesson(false, false, false, false), false)).isTrue();
        assertThat(policy.canReadLessonContent(owner, lesson(false, false, false, false), false)).isTrue();
        assertThatCode(() -> policy.check(owner, lesson(false, false, false, false), Action.DELETE, false))
                .doesNotThrowAnyException();
    }

    @Test
    void strangerIsDeniedUnpublishedContent() {
        assertThat(policy.canRead(student, lesson(true, false, true, false), false)).isFalse();
        assertThatThrownBy(() -> policy.check(student, lesson(true, false, true, false), Action.READ, false))
                .isInstanceOf(ContentAccessDeniedException.class);
    }

    @Test
    void enrolleeKeepsAccessWhenCourseIsUnpublished() {
        assertThat(policy.canRead(student, lesson(false, true, true, false), true)).isTrue();
        assertThat(policy.canReadLessonContent(student, lesson(false, true, true, false), true)).isTrue();
    }

    @Test
    void enrolleeDoesNotSeeUnpublishedModulesOrLessons() {
        assertThat(policy.canRead(student, lesson(true, false, true, false), true)).isFalse();
        assertThat(policy.canRead(student, lesson(true, true, false, false), true)).isFalse();
    }

    @Test
    void enrolledCourseNodeIsReadableWhileUnpublished() {
        ContentNode course = ContentNode.of(10L, OWNER_ID, false, null, null, false);
        assertThat(policy.canRead(student, course, true)).isTrue();
        assertThat(policy.canRead(student, course, false)).isFalse();
    }

    @Test
    void lessonBodyRequiresEnrollmentUnlessFreePreview() {
        assertThat(policy.canReadLessonContent(student, lesson(true, true, true, false), false)).isFalse();
        assertThat(policy.canReadLessonContent(anonymous, lesson(true, true, true, true), false)).isTrue();
        assertThat(policy.canReadLessonContent(anonymous, lesson(false, true, true, true), false)).isFalse();
    }

    @Test
    void onlyOwnerMayWrite() {
        ContentNode published = lesson(true, true, true, false);
        assertThatThrownBy(() -> policy.check(student, published, Action.UPDATE, true))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> policy.check(anonymous, published, Action.CREATE, false))
                .isInstanceOf(AuthenticationRequiredException.class);
        Actor admin = Actor.authenticated(3L, RoleName.ADMIN, true);
        assertThatThrownBy(() -> policy.checkWrite(admin, published))
                .isInstanceOf(PermissionDeniedException.class);
    }
}

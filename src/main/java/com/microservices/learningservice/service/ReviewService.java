package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.PageResponse;
import com.microservices.learningservice.dto.ReviewRequest;
import com.microservices.learningservice.dto.ReviewResponse;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.DuplicateReviewException;
import com.microservices.learningservice.exception.NotEnrolledException;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseReview;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.CourseReviewRepository;
import com.microservices.learningservice.repository.UserProfileRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.Actor;
import com.microservices.learningservice.util.PageableFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    private final CourseReviewRepository reviewRepository;
    private final CourseEnrollmentRepository enrollmentRepository;
    private final UserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final CourseContentService contentService;
    private final NotificationService notificationService;
    private final PageableFactory pageableFactory;

    /**
     * Mean of the ratings rounded half-up to one decimal; 0.0 when there are none.
     */
    public static double averageOf(Collection<Integer> ratings) {
        if (ratings == null || ratings.isEmpty()) {
            return 0.0;
        }
        long sum = ratings.stream().mapToLong(Integer::longValue).sum();
        return BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(ratings.size()), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    @Transactional(readOnly = true)
    public double averageRating(Long courseId) {
        return averageOf(reviewRepository.findPublishedRatings(courseId));
    }

    @Transactional(readOnly = true)
    public long countReviews(Long courseId) {
        return reviewRepository.countByCourseIdAndPublishedTrue(courseId);
    }

    @Transactional
    public ReviewResponse addReview(Actor actor, Long courseId, ReviewRequest request) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        Long studentId = actor.getUserId();
        Course course = contentService.findVisibleCourse(actor, courseId);
        if (!enrollmentRepository.existsByStudentIdAndCourseIdAndActiveTrue(studentId, courseId)) {
            log.warn("User {} tried to review course {} without an active enrollment", studentId, courseId);
            throw new NotEnrolledException("You must be enrolled in this course to review it");
        }
        if (reviewRepository.existsByCourseIdAndStudentId(courseId, studentId)) {
            throw new DuplicateReviewException();
        }

        CourseReview review = new CourseReview();
        review.setCourse(course);
        review.setStudent(userRepository.getReferenceById(studentId));
        review.setRating(request.getRating());
        review.setReviewText(request.getReviewText());
        CourseReview saved = reviewRepository.save(review);
        log.info("User {} reviewed course {} with rating {}", studentId, courseId, request.getRating());

        notificationService.reviewPosted(course, request.getRating());
        UserProfile profile = profileRepository.findById(studentId).orElse(null);
        return toResponse(saved, profile);
    }

    @Transactional(readOnly = true)
    public PageResponse<ReviewResponse> listReviews(Actor actor, Long courseId, Integer page, Integer pageSize) {
        contentService.findVisibleCourse(actor, courseId);
        Page<CourseReview> reviews = reviewRepository.findByCourseIdAndPublishedTrueOrderByCreatedAtDesc(
                courseId, pageableFactory.of(page, pageSize));
        Map<Long, UserProfile> profiles = profileRepository.findAllById(
                        reviews.getContent().stream().map(r -> r.getStudent().getId()).toList())
                .stream()
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));
        return PageResponse.of(reviews, r -> toResponse(r, profiles.get(r.getStudent().getId())));
    }

    private static ReviewResponse toResponse(CourseReview review, UserProfile profile) {
        return ReviewResponse.builder()
                .id(review.getId())
                .rating(review.getRating())
                .reviewText(review.getReviewText())
                .studentName(profile != null ? profile.getDisplayName() : review.getStudent().getEmail())
                .studentAvatar(profile != null ? profile.getAvatar() : null)
                .createdAt(review.getCreatedAt())
                .build();
    }
}

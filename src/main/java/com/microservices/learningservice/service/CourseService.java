package com.microservices.learningservice.service;

import com.microservices.learningservice.dto.CategoryResponse;
import com.microservices.learningservice.dto.CourseDetail;
import com.microservices.learningservice.dto.CourseQuery;
import com.microservices.learningservice.dto.CourseRequest;
import com.microservices.learningservice.dto.CourseSummary;
import com.microservices.learningservice.dto.EnrollmentStatusView;
import com.microservices.learningservice.dto.PageResponse;
import com.microservices.learningservice.dto.TeacherSummary;
import com.microservices.learningservice.exception.AuthenticationRequiredException;
import com.microservices.learningservice.exception.InvalidRequestException;
import com.microservices.learningservice.exception.PermissionDeniedException;
import com.microservices.learningservice.exception.ResourceNotFoundException;
import com.microservices.learningservice.model.Category;
import com.microservices.learningservice.model.Course;
import com.microservices.learningservice.model.CourseEnrollment;
import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.User;
import com.microservices.learningservice.model.UserProfile;
import com.microservices.learningservice.repository.CategoryRepository;
import com.microservices.learningservice.repository.CourseEnrollmentRepository;
import com.microservices.learningservice.repository.CourseRepository;
import com.microservices.learningservice.repository.CourseReviewRepository;
import com.microservices.learningservice.repository.CourseSpecifications;
import com.microservices.learningservice.repository.UserProfileRepository;
import com.microservices.learningservice.repository.UserRepository;
import com.microservices.learningservice.security.AccessPolicy;
import com.microservices.learningservice.security.Actor;
import com.microservices.learningservice.security.ContentNode;
import com.microservices.learningservice.util.PageableFactory;
import com.microservices.learningservice.util.SlugUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CourseService {

    static final int SLUG_MAX_LENGTH = 250;

    private final CourseRepository courseRepository;
    private final CategoryRepository categoryRepository;
    private final UserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final CourseEnrollmentRepository enrollmentRepository;
    private final CourseReviewRepository reviewRepository;
    private final CourseContentService contentService;
    private final ReviewService reviewService;
    private final AccessPolicy accessPolicy;
    private final CacheService cacheService;
    private final PageableFactory pageableFactory;

    /**
     * Public catalog: published courses only, filtered, sorted and paginated.
     */
    @Transactional(readOnly = true)
    public PageResponse<CourseSummary> listCourses(Actor actor, CourseQuery query) {
        Specification<Course> spec = Specification.where(CourseSpecifications.published());
        if (query.getSearch() != null && !query.getSearch().isBlank()) {
            spec = spec.and(CourseSpecifications.matches(query.getSearch()));
        }
        if (query.getCategory() != null && !query.getCategory().isBlank()) {
            spec = spec.and(CourseSpecifications.inCategory(query.getCategory()));
        }
        if (query.getLevel() != null) {
            spec = spec.and(CourseSpecifications.hasLevel(query.getLevel()));
        }
        if (query.getLanguage() != null) {
            spec = spec.and(CourseSpecifications.hasLanguage(query.getLanguage()));
        }
        if (query.getPrice() != null && !query.getPrice().isBlank()) {
            switch (query.getPrice().toLowerCase()) {
                case "free" -> spec = spec.and(CourseSpecifications.isFree(true));
                case "paid" -> spec = spec.and(CourseSpecifications.isFree(false));
                default -> throw new InvalidRequestException("price", "Price filter must be 'free' or 'paid'");
            }
        }
        if (query.getTeacher() != null) {
            spec = spec.and(CourseSpecifications.taughtBy(query.getTeacher()));
        }

        Sort sort = Sort.unsorted();
        String sortKey = query.getSort() == null ? "newest" : query.getSort();
        switch (sortKey) {
            case "newest" -> sort = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
            case "price_low" -> sort = Sort.by(Sort.Order.asc("price"), Sort.Order.desc("id"));
            case "price_high" -> sort = Sort.by(Sort.Order.desc("price"), Sort.Order.desc("id"));
            case "popular" -> spec = spec.and(CourseSpecifications.orderByPopularity());
            case "rating" -> spec = spec.and(CourseSpecifications.orderByRating());
            default -> throw new InvalidRequestException("sort",
                    "Sort must be one of newest, popular, rating, price_low, price_high");
        }

        Pageable pageable = pageableFactory.of(query.getPage(), query.getPageSize(), sort);
        Page<Course> courses = courseRepository.findAll(spec, pageable);
        return toSummaryPage(actor, courses);
    }

    /**
     * Course detail by slug. A course the caller may not see is reported as not found.
     */
    @Transactional(readOnly = true)
    public CourseDetail getCourse(Actor actor, String slug) {
        Course course = courseRepository.findBySlug(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Course not found"));
        Optional<CourseEnrollment> enrollment = actor.isAnonymous()
                ? Optional.empty()
                : enrollmentRepository.findByStudentIdAndCourseId(actor.getUserId(), course.getId());
        boolean enrolled = enrollment.filter(CourseEnrollment::isActive).isPresent();
        if (!accessPolicy.canRead(actor, ContentNode.of(course), enrolled)) {
            log.debug("Hiding course {} from user {}", course.getId(), actor.getUserId());
            throw new ResourceNotFoundException("Course not found");
        }
        cacheService.recordCourseView(course.getId());
        return toDetail(actor, course, enrollment.orElse(null), enrolled);
    }

    @Transactional
    public CourseDetail createCourse(Actor actor, CourseRequest request) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        if (!actor.hasRole(RoleName.TEACHER)) {
            throw new PermissionDeniedException("Only teachers can create courses");
        }
        Map<String, String> errors = new LinkedHashMap<>();
        if (request.getTitle() == null || request.getTitle().isBlank()) {
            errors.put("title", "Title is required");
        }
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            errors.put("description", "Description is required");
        }
        if (!errors.isEmpty()) {
            throw new InvalidRequestException("Invalid course", errors);
        }

        User teacher = userRepository.findById(actor.getUserId())
                .orElseThrow(() -> ResourceNotFoundException.of("User", actor.getUserId()));
        Course course = new Course();
        course.setTeacher(teacher);
        course.setTitle(request.getTitle().trim());
        course.setSlug(SlugUtil.uniqueSlug(course.getTitle(), SLUG_MAX_LENGTH, courseRepository::existsBySlug));
        applyFields(course, request);

        Course saved = courseRepository.save(course);
        log.info("Creating course: {} ({}) by teacher: {}", saved.getTitle(), saved.getSlug(), teacher.getId());
        return toDetail(actor, saved, null, false);
    }

    /**
     * Partial update by the owner. The slug is fixed at creation and does not follow the title.
     */
    @Transactional
    public CourseDetail updateCourse(Actor actor, String slug, CourseRequest request) {
        Course course = courseRepository.findBySlug(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Course not found"));
        accessPolicy.checkWrite(actor, ContentNode.of(course));
        if (request.getTitle() != null) {
            if (request.getTitle().isBlank()) {
                throw new InvalidRequestException("title", "Title must not be blank");
            }
            course.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null && request.getDescription().isBlank()) {
            throw new InvalidRequestException("description", "Description must not be blank");
        }
        applyFields(course, request);
        Course saved = courseRepository.save(course);
        log.info("Updated course {}", saved.getId());
        return toDetail(actor, saved, null, false);
    }

    @Transactional
    public void deleteCourse(Actor actor, String slug) {
        Course course = courseRepository.findBySlug(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Course not found"));
        accessPolicy.checkWrite(actor, ContentNode.of(course));
        courseRepository.delete(course);
        cacheService.clearCourseCounters(course.getId());
        log.info("Deleted course {} ({})", course.getId(), slug);
    }

    @Transactional(readOnly = true)
    public PageResponse<CourseSummary> myTeaching(Actor actor, Integer page, Integer pageSize) {
        if (actor.isAnonymous()) {
            throw new AuthenticationRequiredException();
        }
        if (!actor.hasRole(RoleName.TEACHER)) {
            throw new PermissionDeniedException("Only teachers have teaching courses");
        }
        Page<Course> courses = courseRepository.findByTeacherIdOrderByCreatedAtDesc(
                actor.getUserId(), pageableFactory.of(page, pageSize));
        return toSummaryPage(actor, courses);
    }

    /**
     * Recent activity counters: detail views in the last 24h and enrollments in the last 7 days.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> getViews(Actor actor, Long courseId) {
        contentService.findVisibleCourse(actor, courseId);
        return Map.of(
                "courseId", courseId,
                "views", cacheService.getCourseViews(courseId),
                "recentEnrollments", cacheService.getRecentEnrollments(courseId));
    }

    private void applyFields(Course course, CourseRequest request) {
        if (request.getDescription() != null) {
            course.setDescription(request.getDescription());
        }
        if (request.getLanguage() != null) {
            course.setLanguage(request.getLanguage());
        }
        if (request.getPrice() != null) {
            course.setPrice(request.getPrice());
        }
        if (request.getCurrency() != null) {
            course.setCurrency(request.getCurrency());
        }
        if (request.getFree() != null) {
            course.setFree(request.getFree());
        }
        if (request.getThumbnailUrl() != null) {
            course.setThumbnailUrl(request.getThumbnailUrl());
        }
        if (request.getLevel() != null) {
            course.setLevel(request.getLevel());
        }
        if (request.getDurationHours() != null) {
            course.setDurationHours(request.getDurationHours());
        }
        if (request.getMaxStudents() != null) {
            course.setMaxStudents(request.getMaxStudents());
        }
        if (request.getPrerequisites() != null) {
            course.setPrerequisites(request.getPrerequisites());
        }
        if (request.getLearningObjectives() != null) {
            course.setLearningObjectives(request.getLearningObjectives());
        }
        if (request.getTags() != null) {
            course.setTags(request.getTags());
        }
        if (request.getPublished() != null) {
            course.setPublished(request.getPublished());
        }
        if (request.getCategoryIds() != null) {
            List<Category> categories = categoryRepository.findAllById(request.getCategoryIds());
            if (categories.size() != request.getCategoryIds().size()) {
                throw new InvalidRequestException("categoryIds", "One or more categories do not exist");
            }
            course.setCategories(new HashSet<>(categories));
        }
    }

    private PageResponse<CourseSummary> toSummaryPage(Actor actor, Page<Course> courses) {
        List<Course> content = courses.getContent();
        if (content.isEmpty()) {
            return new PageResponse<>(courses.getTotalElements(), courses.getNumber() + 1,
                    courses.getSize(), courses.getTotalPages(), List.of());
        }
        List<Long> ids = content.stream().map(Course::getId).toList();

        Map<Long, Long> enrolledCounts = new HashMap<>();
        for (Object[] row : enrollmentRepository.countActiveByCourseIds(ids)) {
            enrolledCounts.put((Long) row[0], (Long) row[1]);
        }
        Map<Long, List<Integer>> ratings = new HashMap<>();
        for (Object[] row : reviewRepository.findPublishedRatingsByCourseIds(ids)) {
            ratings.computeIfAbsent((Long) row[0], k -> new ArrayList<>()).add((Integer) row[1]);
        }
        Set<Long> enrolledIn = actor.isAnonymous()
                ? Set.of()
                : new HashSet<>(enrollmentRepository.findActiveCourseIds(actor.getUserId(), ids));
        Map<Long, UserProfile> teachers = teacherProfiles(content.stream().map(c -> c.getTeacher().getId()).toList());

        return PageResponse.of(courses, c -> CourseSummary.builder()
                .id(c.getId())
                .title(c.getTitle())
                .slug(c.getSlug())
                .description(c.getDescription())
                .teacher(teacherSummary(c.getTeacher(), teachers.get(c.getTeacher().getId())))
                .language(c.getLanguage())
                .price(c.getPrice())
                .currency(c.getCurrency())
                .free(c.isFree())
                .published(c.isPublished())
                .thumbnailUrl(c.getThumbnailUrl())
                .level(c.getLevel())
                .durationHours(c.getDurationHours())
                .categories(c.getCategories().stream().map(Category::getTitle).sorted().toList())
                .enrolledCount(enrolledCounts.getOrDefault(c.getId(), 0L))
                .averageRating(ReviewService.averageOf(ratings.get(c.getId())))
                .enrolled(enrolledIn.contains(c.getId()))
                .createdAt(c.getCreatedAt())
                .build());
    }

    private CourseDetail toDetail(Actor actor, Course course, CourseEnrollment enrollment, boolean enrolled) {
        UserProfile teacherProfile = profileRepository.findById(course.getTeacher().getId()).orElse(null);
        return CourseDetail.builder()
                .id(course.getId())
                .title(course.getTitle())
                .slug(course.getSlug())
                .description(course.getDescription())
                .teacher(teacherSummary(course.getTeacher(), teacherProfile))
                .language(course.getLanguage())
                .price(course.getPrice())
                .currency(course.getCurrency())
                .free(course.isFree())
                .published(course.isPublished())
                .thumbnailUrl(course.getThumbnailUrl())
                .level(course.getLevel())
                .durationHours(course.getDurationHours())
                .maxStudents(course.getMaxStudents())
                .prerequisites(course.getPrerequisites())
                .learningObjectives(course.getLearningObjectives())
                .tags(course.getTags())
                .categories(course.getCategories().stream()
                        .sorted(Comparator.comparing(Category::getTitle))
                        .map(c -> CategoryResponse.from(c, null))
                        .toList())
                .enrolledCount(enrollmentRepository.countByCourseIdAndActiveTrue(course.getId()))
                .averageRating(reviewService.averageRating(course.getId()))
                .reviewsCount(reviewService.countReviews(course.getId()))
                .enrolled(enrolled)
                .enrollmentStatus(enrollment != null ? EnrollmentStatusView.from(enrollment) : null)
                .modules(contentService.visibleModules(actor, course, enrolled))
                .createdAt(course.getCreatedAt())
                .updatedAt(course.getUpdatedAt())
                .build();
    }

    private Map<Long, UserProfile> teacherProfiles(Collection<Long> teacherIds) {
        return profileRepository.findAllById(new HashSet<>(teacherIds)).stream()
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));
    }

    private static TeacherSummary teacherSummary(User teacher, UserProfile profile) {
        return TeacherSummary.builder()
                .id(teacher.getId())
                .email(teacher.getEmail())
                .firstName(profile != null ? profile.getFirstName() : null)
                .lastName(profile != null ? profile.getLastName() : null)
                .avatar(profile != null ? profile.getAvatar() : null)
                .build();
    }
}

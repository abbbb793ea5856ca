package com.microservices.learningservice.controller;

import com.microservices.learningservice.dto.CourseDetail;
import com.microservices.learningservice.dto.CourseQuery;
import com.microservices.learningservice.dto.CourseRequest;
import com.microservices.learningservice.dto.CourseSummary;
import com.microservices.learningservice.dto.EnrollmentResponse;
import com.microservices.learningservice.dto.LessonProgressResponse;
import com.microservices.learningservice.dto.ModuleRequest;
import com.microservices.learningservice.dto.ModuleResponse;
import com.microservices.learningservice.dto.PageResponse;
import com.microservices.learningservice.dto.ReviewRequest;
import com.microservices.learningservice.dto.ReviewResponse;
import com.microservices.learningservice.service.CourseContentService;
import com.microservices.learningservice.service.CourseService;
import com.microservices.learningservice.service.EnrollmentService;
import com.microservices.learningservice.service.ProgressService;
import com.microservices.learningservice.service.ReviewService;
import com.microservices.learningservice.util.RoleUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
@Slf4j
public class CourseController {

    private final CourseService courseService;
    private final CourseContentService contentService;
    private final EnrollmentService enrollmentService;
    private final ProgressService progressService;
    private final ReviewService reviewService;

    @GetMapping
    public ResponseEntity<PageResponse<CourseSummary>> listCourses(
            @ModelAttribute CourseQuery query,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courseService.listCourses(RoleUtil.actorOf(jwt), query));
    }

    @PostMapping
    public ResponseEntity<CourseDetail> createCourse(
            @Valid @RequestBody CourseRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CourseDetail created = courseService.createCourse(RoleUtil.actorOf(jwt), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/my/enrolled")
    public ResponseEntity<PageResponse<EnrollmentResponse>> myEnrolled(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(enrollmentService.myEnrollments(RoleUtil.actorOf(jwt), page, pageSize));
    }

    @GetMapping("/my/teaching")
    public ResponseEntity<PageResponse<CourseSummary>> myTeaching(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courseService.myTeaching(RoleUtil.actorOf(jwt), page, pageSize));
    }

    @GetMapping("/{slug}")
    public ResponseEntity<CourseDetail> getCourse(@PathVariable String slug, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courseService.getCourse(RoleUtil.actorOf(jwt), slug));
    }

    @PutMapping("/{slug}")
    public ResponseEntity<CourseDetail> updateCourse(
            @PathVariable String slug,
            @Valid @RequestBody CourseRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courseService.updateCourse(RoleUtil.actorOf(jwt), slug, request));
    }

    @DeleteMapping("/{slug}")
    public ResponseEntity<Void> deleteCourse(@PathVariable String slug, @AuthenticationPrincipal Jwt jwt) {
        courseService.deleteCourse(RoleUtil.actorOf(jwt), slug);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enroll")
    public ResponseEntity<EnrollmentResponse> enroll(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        EnrollmentResponse enrollment = enrollmentService.enroll(RoleUtil.actorOf(jwt), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(enrollment);
    }

    @PostMapping("/{id}/unenroll")
    public ResponseEntity<EnrollmentResponse> unenroll(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(enrollmentService.unenroll(RoleUtil.actorOf(jwt), id));
    }

    @GetMapping("/{id}/progress")
    public ResponseEntity<List<LessonProgressResponse>> courseProgress(
            @PathVariable Long id,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(progressService.courseProgress(RoleUtil.actorOf(jwt), id));
    }

    @GetMapping("/{id}/reviews")
    public ResponseEntity<PageResponse<ReviewResponse>> listReviews(
            @PathVariable Long id,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(reviewService.listReviews(RoleUtil.actorOf(jwt), id, page, pageSize));
    }

    @PostMapping("/{id}/reviews")
    public ResponseEntity<ReviewResponse> addReview(
            @PathVariable Long id,
            @Valid @RequestBody ReviewRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        ReviewResponse review = reviewService.addReview(RoleUtil.actorOf(jwt), id, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(review);
    }

    @GetMapping("/{id}/modules")
    public ResponseEntity<List<ModuleResponse>> listModules(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(contentService.listModules(RoleUtil.actorOf(jwt), id));
    }

    @PostMapping("/{id}/modules")
    public ResponseEntity<ModuleResponse> createModule(
            @PathVariable Long id,
            @Valid @RequestBody ModuleRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        ModuleResponse module = contentService.createModule(RoleUtil.actorOf(jwt), id, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(module);
    }

    @GetMapping("/{id}/views")
    public ResponseEntity<Map<String, Object>> getCourseViews(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(courseService.getViews(RoleUtil.actorOf(jwt), id));
    }
}

package com.microservices.learningservice.controller;

import com.microservices.learningservice.dto.LessonProgressRequest;
import com.microservices.learningservice.dto.LessonProgressResponse;
import com.microservices.learningservice.dto.LessonRequest;
import com.microservices.learningservice.dto.LessonResponse;
import com.microservices.learningservice.service.CourseContentService;
import com.microservices.learningservice.service.ProgressService;
import com.microservices.learningservice.util.RoleUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/lessons")
@RequiredArgsConstructor
public class LessonController {

    private final CourseContentService contentService;
    private final ProgressService progressService;

    @GetMapping("/{id}")
    public ResponseEntity<LessonResponse> getLesson(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(contentService.getLesson(RoleUtil.actorOf(jwt), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<LessonResponse> updateLesson(
            @PathVariable Long id,
            @Valid @RequestBody LessonRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(contentService.updateLesson(RoleUtil.actorOf(jwt), id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteLesson(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        contentService.deleteLesson(RoleUtil.actorOf(jwt), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/progress")
    public ResponseEntity<LessonProgressResponse> updateProgress(
            @PathVariable Long id,
            @Valid @RequestBody LessonProgressRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(progressService.recordLessonProgress(RoleUtil.actorOf(jwt), id, request));
    }
}

package com.microservices.learningservice.controller;

import com.microservices.learningservice.dto.LessonRequest;
import com.microservices.learningservice.dto.LessonResponse;
import com.microservices.learningservice.dto.ModuleRequest;
import com.microservices.learningservice.dto.ModuleResponse;
import com.microservices.learningservice.service.CourseContentService;
import com.microservices.learningservice.util.RoleUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/modules")
@RequiredArgsConstructor
public class ModuleController {

    private final CourseContentService contentService;

    @GetMapping("/{id}")
    public ResponseEntity<ModuleResponse> getModule(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(contentService.getModule(RoleUtil.actorOf(jwt), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ModuleResponse> updateModule(
            @PathVariable Long id,
            @Valid @RequestBody ModuleRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(contentService.updateModule(RoleUtil.actorOf(jwt), id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteModule(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        contentService.deleteModule(RoleUtil.actorOf(jwt), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/lessons")
    public ResponseEntity<List<LessonResponse>> listLessons(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(contentService.listLessons(RoleUtil.actorOf(jwt), id));
    }

    @PostMapping("/{id}/lessons")
    public ResponseEntity<LessonResponse> createLesson(
            @PathVariable Long id,
            @Valid @RequestBody LessonRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        LessonResponse lesson = contentService.createLesson(RoleUtil.actorOf(jwt), id, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(lesson);
    }
}

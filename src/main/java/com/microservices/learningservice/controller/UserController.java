package com.microservices.learningservice.controller;

import com.microservices.learningservice.dto.ProfileResponse;
import com.microservices.learningservice.dto.ProfileUpdateRequest;
import com.microservices.learningservice.service.UserProfileService;
import com.microservices.learningservice.util.RoleUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserProfileService profileService;

    @GetMapping("/profile")
    public ResponseEntity<ProfileResponse> getProfile(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(profileService.getProfile(RoleUtil.actorOf(jwt).getUserId()));
    }

    @PutMapping("/profile")
    public ResponseEntity<ProfileResponse> updateProfile(
            @Valid @RequestBody ProfileUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(profileService.updateProfile(RoleUtil.actorOf(jwt).getUserId(), request));
    }

    @GetMapping("/by-role")
    public ResponseEntity<List<ProfileResponse>> getByRole(@RequestParam("role") String role) {
        return ResponseEntity.ok(profileService.listByRole(role));
    }
}

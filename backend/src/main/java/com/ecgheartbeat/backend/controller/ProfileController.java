package com.ecgheartbeat.backend.controller;

import com.ecgheartbeat.backend.dto.ApiResponse;
import com.ecgheartbeat.backend.dto.UpdateProfileRequest;
import com.ecgheartbeat.backend.dto.UserProfileDto;
import com.ecgheartbeat.backend.service.ProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;

    @GetMapping("/{userId}")
    public ResponseEntity<ApiResponse> getProfile(@PathVariable Long userId) {
        return ResponseEntity.ok(ApiResponse.success("Profile retrieved successfully")
                .with("user", UserProfileDto.fromEntity(profileService.getProfile(userId))));
    }

    @PutMapping("/update")
    public ResponseEntity<ApiResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Profile updated successfully")
                .with("user", UserProfileDto.fromEntity(profileService.updateProfile(request))));
    }
}

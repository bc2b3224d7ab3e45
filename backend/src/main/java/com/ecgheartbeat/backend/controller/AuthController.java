package com.ecgheartbeat.backend.controller;

import com.ecgheartbeat.backend.dto.ApiResponse;
import com.ecgheartbeat.backend.dto.LoginRequest;
import com.ecgheartbeat.backend.dto.RegisterRequest;
import com.ecgheartbeat.backend.dto.UserProfileDto;
import com.ecgheartbeat.backend.entity.User;
import com.ecgheartbeat.backend.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<ApiResponse> register(@Valid @RequestBody RegisterRequest registerRequest) {
        User user = authService.register(registerRequest);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("User registered successfully")
                        .with("user", UserProfileDto.fromEntity(user)));
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse> login(@Valid @RequestBody LoginRequest loginRequest) {
        User user = authService.login(loginRequest);
        String token = authService.issueToken(user);
        return ResponseEntity.ok(ApiResponse.success("Login successful")
                .with("token", token)
                .with("user", UserProfileDto.fromEntity(user)));
    }
}

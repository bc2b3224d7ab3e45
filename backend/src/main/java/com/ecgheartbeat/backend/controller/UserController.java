package com.ecgheartbeat.backend.controller;

import com.ecgheartbeat.backend.dto.ApiResponse;
import com.ecgheartbeat.backend.dto.UserAccountDto;
import com.ecgheartbeat.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping("/all")
    public ResponseEntity<ApiResponse> getAllUsers() {
        List<UserAccountDto> users = userService.listAll().stream()
                .map(UserAccountDto::fromEntity)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Users retrieved successfully")
                .with("users", users)
                .with("count", users.size()));
    }
}

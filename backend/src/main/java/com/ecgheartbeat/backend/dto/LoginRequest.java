package com.ecgheartbeat.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "Username and password are required") String username,
        @NotBlank(message = "Username and password are required") String password
) {}

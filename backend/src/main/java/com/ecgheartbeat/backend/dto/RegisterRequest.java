package com.ecgheartbeat.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RegisterRequest(
        @NotBlank(message = "All fields are required") String username,
        @NotBlank(message = "All fields are required") String password,
        @NotNull(message = "All fields are required") Integer age,
        @NotBlank(message = "All fields are required") String gender
) {}

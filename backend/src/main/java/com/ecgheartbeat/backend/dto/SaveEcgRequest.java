package com.ecgheartbeat.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record SaveEcgRequest(
        @NotNull(message = "User ID, username, and BPM are required") Long userId,
        @NotBlank(message = "User ID, username, and BPM are required") String username,
        @NotNull(message = "User ID, username, and BPM are required")
        @Positive(message = "User ID, username, and BPM are required") Integer bpm
) {}

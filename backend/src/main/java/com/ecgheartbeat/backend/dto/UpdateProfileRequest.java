package com.ecgheartbeat.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Profile update. {@code newPassword} requires {@code oldPassword}; a bare {@code password} replaces the stored one.
 */
public record UpdateProfileRequest(
        @NotNull(message = "User ID, username, age, and gender are required") Long userId,
        @NotBlank(message = "User ID, username, age, and gender are required") String username,
        @NotNull(message = "User ID, username, age, and gender are required") Integer age,
        @NotBlank(message = "User ID, username, age, and gender are required") String gender,
        String password,
        String oldPassword,
        String newPassword
) {
    public boolean changesPasswordWithVerification() {
        return newPassword != null && !newPassword.isBlank();
    }

    public boolean replacesPassword() {
        return password != null && !password.isBlank();
    }
}

package com.ecgheartbeat.backend.dto;

import com.ecgheartbeat.backend.entity.User;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

/**
 * Full user row as listed by {@code GET /api/users/all}, password included.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserAccountDto(
        Long id,
        String username,
        String password,
        Integer age,
        String gender,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static UserAccountDto fromEntity(User user) {
        return new UserAccountDto(
                user.getId(),
                user.getUsername(),
                user.getPassword(),
                user.getAge(),
                user.getGender(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}

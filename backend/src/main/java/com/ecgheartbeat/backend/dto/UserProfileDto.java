package com.ecgheartbeat.backend.dto;

import com.ecgheartbeat.backend.entity.User;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserProfileDto(
        Long id,
        String username,
        Integer age,
        String gender,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static UserProfileDto fromEntity(User user) {
        return new UserProfileDto(
                user.getId(),
                user.getUsername(),
                user.getAge(),
                user.getGender(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}

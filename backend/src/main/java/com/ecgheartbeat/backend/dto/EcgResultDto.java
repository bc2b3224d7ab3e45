package com.ecgheartbeat.backend.dto;

import com.ecgheartbeat.backend.entity.EcgResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EcgResultDto {
    Long id;
    Long userId;
    String username;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate tanggal;
    @JsonFormat(pattern = "HH:mm:ss")
    LocalTime waktu;
    int bpm;
    String status;
    String kondisi;
    LocalDateTime createdAt;

    public static EcgResultDto fromEntity(EcgResult entity) {
        return EcgResultDto.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .username(entity.getUsername())
                .tanggal(entity.getTanggal())
                .waktu(entity.getWaktu())
                .bpm(entity.getBpm())
                .status(entity.getStatus())
                .kondisi(entity.getKondisi())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}

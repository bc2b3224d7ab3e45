package com.ecgheartbeat.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A single heart-rate reading. Rows are written once and never updated.
 */
@Entity
@Table(name = "ecg_results", indexes = {
    @Index(name = "idx_ecg_results_user_recorded", columnList = "user_id, tanggal, waktu")
})
@Getter
@NoArgsConstructor
public class EcgResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    // Username as it was when the reading was taken.
    @Column(nullable = false)
    private String username;

    @Column(nullable = false)
    private LocalDate tanggal;

    @Column(nullable = false)
    private LocalTime waktu;

    @Column(nullable = false)
    private int bpm;

    @Column(nullable = false, length = 16)
    private String status;

    @Column(nullable = false)
    private String kondisi;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public EcgResult(Long userId, String username, LocalDate tanggal, LocalTime waktu,
                     int bpm, EcgStatus status, String kondisi, LocalDateTime createdAt) {
        this.userId = userId;
        this.username = username;
        this.tanggal = tanggal;
        this.waktu = waktu;
        this.bpm = bpm;
        this.status = status.getLabel();
        this.kondisi = kondisi;
        this.createdAt = createdAt;
    }
}

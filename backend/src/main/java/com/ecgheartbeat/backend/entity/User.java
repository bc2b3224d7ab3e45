package com.ecgheartbeat.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(name = "uk_users_username", columnNames = {"username"})
})
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String username;

    // Stored as submitted; login compares by equality.
    @Column(nullable = false)
    private String password;

    @Column(nullable = false)
    private Integer age;

    @Column(nullable = false)
    private String gender;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public User(String username, String password, Integer age, String gender, LocalDateTime createdAt) {
        this.username = username;
        this.password = password;
        this.age = age;
        this.gender = gender;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public User updateProfile(String username, Integer age, String gender, LocalDateTime updatedAt) {
        this.username = username;
        this.age = age;
        this.gender = gender;
        this.updatedAt = updatedAt;
        return this;
    }
}

package com.ecgheartbeat.backend.service;

import com.ecgheartbeat.backend.dto.LoginRequest;
import com.ecgheartbeat.backend.dto.RegisterRequest;
import com.ecgheartbeat.backend.entity.User;
import com.ecgheartbeat.backend.exception.ConflictException;
import com.ecgheartbeat.backend.exception.InvalidCredentialsException;
import com.ecgheartbeat.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    public static final String USERNAME_TAKEN = "USERNAME_TAKEN";

    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * The existence check gives the friendly error; the unique constraint on
     * {@code users.username} catches registrations that race past it.
     */
    @Transactional
    public User register(RegisterRequest req) {
        if (userRepository.existsByUsername(req.username())) {
            throw new ConflictException(USERNAME_TAKEN, "Username already taken");
        }

        User user = new User(req.username(), req.password(), req.age(), req.gender(), LocalDateTime.now(clock));
        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("Registered user {} ({})", saved.getUsername(), saved.getId());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            log.info("Concurrent registration lost for username {}", req.username());
            throw new ConflictException(USERNAME_TAKEN, "Username already taken");
        }
    }

    @Transactional(readOnly = true)
    public User login(LoginRequest req) {
        return userRepository.findByUsernameAndPassword(req.username(), req.password())
                .orElseThrow(() -> new InvalidCredentialsException("Invalid username or password"));
    }

    /**
     * Opaque bearer string built from the user id and issue time. Nothing verifies it.
     */
    public String issueToken(User user) {
        return "token_" + user.getId() + "_" + clock.millis();
    }
}

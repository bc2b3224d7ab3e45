package com.ecgheartbeat.backend.service;

import com.ecgheartbeat.backend.dto.UpdateProfileRequest;
import com.ecgheartbeat.backend.entity.User;
import com.ecgheartbeat.backend.exception.ConflictException;
import com.ecgheartbeat.backend.exception.NotFoundException;
import com.ecgheartbeat.backend.exception.ValidationException;
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
public class ProfileService {

    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public User getProfile(Long userId) {
        return loadUser(userId);
    }

    @Transactional
    public User updateProfile(UpdateProfileRequest req) {
        User user = loadUser(req.userId());

        if (userRepository.existsByUsernameAndIdNot(req.username(), user.getId())) {
            throw new ConflictException(AuthService.USERNAME_TAKEN, "Username already taken");
        }

        if (req.changesPasswordWithVerification()) {
            if (req.oldPassword() == null || req.oldPassword().isBlank()) {
                throw new ValidationException("Current password is required to set a new password");
            }
            if (!req.oldPassword().equals(user.getPassword())) {
                throw new ValidationException("INVALID_OLD_PASSWORD", "Current password is incorrect");
            }
            user.setPassword(req.newPassword());
        } else if (req.replacesPassword()) {
            user.setPassword(req.password());
        }

        user.updateProfile(req.username(), req.age(), req.gender(), LocalDateTime.now(clock));
        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("Updated profile of user {}", saved.getId());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException(AuthService.USERNAME_TAKEN, "Username already taken");
        }
    }

    private User loadUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException(USER_NOT_FOUND, "User not found"));
    }
}

package com.ecgheartbeat.backend.service;

import com.ecgheartbeat.backend.entity.User;
import com.ecgheartbeat.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public List<User> listAll() {
        return userRepository.findAllByOrderByCreatedAtDesc();
    }
}

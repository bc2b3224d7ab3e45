package com.ecgheartbeat.backend.controller;

import com.ecgheartbeat.backend.config.SecurityConfig;
import com.ecgheartbeat.backend.dto.LoginRequest;
import com.ecgheartbeat.backend.dto.RegisterRequest;
import com.ecgheartbeat.backend.entity.User;
import com.ecgheartbeat.backend.exception.ConflictException;
import com.ecgheartbeat.backend.exception.InvalidCredentialsException;
import com.ecgheartbeat.backend.service.AuthService;
import com.ecgheartbeat.backend.storage.StorageGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuthController.class)
@Import(SecurityConfig.class)
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuthService authService;

    @MockBean
    private StorageGateway storageGateway;

    @Test
    @DisplayName("Registration with a missing field is rejected")
    void registerRequiresAllFields() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"rina\", \"password\": \"pw\", \"gender\": \"female\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("All fields are required"));
        verifyNoInteractions(authService);
    }

    @Test
    @DisplayName("Registration answers 201 without echoing the password")
    void registerCreated() throws Exception {
        User user = new User("rina", "pw", 27, "female", LocalDateTime.of(2026, 10, 19, 8, 0));
        ReflectionTestUtils.setField(user, "id", 3L);
        when(authService.register(any(RegisterRequest.class))).thenReturn(user);

        mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"rina\", \"password\": \"pw\", \"age\": 27, \"gender\": \"female\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.user.id").value(3))
                .andExpect(jsonPath("$.user.username").value("rina"))
                .andExpect(jsonPath("$.user.created_at").value("2026-10-19T08:00:00"))
                .andExpect(jsonPath("$.user.password").doesNotExist());
    }

    @Test
    @DisplayName("Duplicate username is 409")
    void registerConflict() throws Exception {
        when(authService.register(any(RegisterRequest.class)))
                .thenThrow(new ConflictException(AuthService.USERNAME_TAKEN, "Username already taken"));

        mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"rina\", \"password\": \"pw\", \"age\": 27, \"gender\": \"female\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Username already taken"));
    }

    @Test
    @DisplayName("Bad credentials are 401, missing ones 400")
    void loginFailures() throws Exception {
        when(authService.login(any(LoginRequest.class)))
                .thenThrow(new InvalidCredentialsException("Invalid username or password"));

        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"rina\", \"password\": \"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid username or password"));

        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"rina\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username and password are required"));
    }

    @Test
    @DisplayName("Malformed JSON is a validation error")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }

    @Test
    @DisplayName("A body that is not declared as JSON is a client error, not a 500")
    void nonJsonContentType() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.TEXT_PLAIN)
                .content("{\"username\": \"rina\", \"password\": \"pw\", \"age\": 27, \"gender\": \"female\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Request body must be JSON (Content-Type: application/json)"))
                .andExpect(jsonPath("$.debug").doesNotExist());

        mockMvc.perform(post("/api/auth/login")
                .content("{\"username\": \"rina\", \"password\": \"pw\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
        verifyNoInteractions(authService);
    }
}

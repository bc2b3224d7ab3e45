package com.ecgheartbeat.backend.filter;

import com.ecgheartbeat.backend.storage.StorageGateway;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects store-backed routes up front while no database is configured.
 */
@Component
@RequiredArgsConstructor
public class StorageAvailabilityInterceptor implements HandlerInterceptor {

    private final StorageGateway storageGateway;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        storageGateway.requireConfigured();
        return true;
    }
}

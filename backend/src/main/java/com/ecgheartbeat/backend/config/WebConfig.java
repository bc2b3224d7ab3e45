package com.ecgheartbeat.backend.config;

import com.ecgheartbeat.backend.filter.StorageAvailabilityInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final StorageAvailabilityInterceptor storageAvailabilityInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(storageAvailabilityInterceptor)
                .addPathPatterns("/api/auth/**", "/api/users/**", "/api/profile/**", "/api/ecg/**");
    }
}

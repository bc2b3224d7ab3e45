package com.ecgheartbeat.backend.config;

import com.ecgheartbeat.backend.storage.StorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class StartupReport implements CommandLineRunner {

    private final StorageGateway storageGateway;

    @Value("${server.port:3000}")
    private int port;

    @Override
    public void run(String... args) {
        log.info("ECG Heartbeat Backend running on port {}", port);
        log.info("Test URL: http://localhost:{}/api/test", port);
        log.info("Health check: http://localhost:{}/health", port);
        log.info("Database: {}", storageGateway.health().getLabel());
    }
}

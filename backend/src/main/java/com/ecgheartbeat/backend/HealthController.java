package com.ecgheartbeat.backend;

import com.ecgheartbeat.backend.storage.StorageGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final StorageGateway storageGateway;
    private final Clock clock;
    private final String version;
    private final boolean includeDebug;
    private final String port;

    public HealthController(StorageGateway storageGateway, Clock clock,
                            @Value("${ecg.api.version:1.0.0}") String version,
                            @Value("${ecg.api.include-debug:true}") boolean includeDebug,
                            @Value("${PORT:not set}") String port) {
        this.storageGateway = storageGateway;
        this.clock = clock;
        this.version = version;
        this.includeDebug = includeDebug;
        this.port = port;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "OK");
        status.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
        status.put("timestamp", Instant.now(clock).toString());
        status.put("database", storageGateway.health());
        if (includeDebug) {
            Map<String, Object> debug = new LinkedHashMap<>();
            debug.put("pool_exists", storageGateway.hasPool());
            debug.put("env_exists", storageGateway.isConfigured());
            status.put("debug", debug);
        }
        return status;
    }

    @GetMapping("/api/test")
    public Map<String, Object> liveness() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("message", "ECG Heartbeat Backend API is working!");
        status.put("timestamp", Instant.now(clock).toString());
        status.put("status", "success");
        status.put("version", version);
        status.put("database", storageGateway.isConfigured() ? "configured" : "not configured");
        if (includeDebug) {
            Map<String, Object> debug = new LinkedHashMap<>();
            debug.put("DATABASE_URL_EXISTS", storageGateway.isConfigured());
            debug.put("PORT", port);
            status.put("debug", debug);
        }
        return status;
    }
}

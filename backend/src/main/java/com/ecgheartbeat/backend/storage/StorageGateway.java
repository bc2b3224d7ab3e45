package com.ecgheartbeat.backend.storage;

import com.ecgheartbeat.backend.exception.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the view of the relational store: whether it is configured and whether it answers.
 * Queries themselves go through the JPA repositories inside transactional service methods.
 */
@Component
@Slf4j
public class StorageGateway {

    private final DataSource dataSource;
    private final boolean configured;

    public StorageGateway(DataSource dataSource, @Value("${ecg.database.url:}") String connectionString) {
        this.dataSource = dataSource;
        this.configured = connectionString != null && !connectionString.isBlank();
    }

    public boolean isConfigured() {
        return configured;
    }

    /**
     * False when no pool could be built, either because the connection string is unset or because it did not parse.
     */
    public boolean hasPool() {
        return !(dataSource instanceof UnconfiguredDataSource);
    }

    public void requireConfigured() {
        if (!configured) {
            throw StorageUnavailableException.notConfigured();
        }
    }

    /**
     * Borrows one connection and hands it straight back.
     */
    public DatabaseStatus health() {
        if (!configured) {
            return DatabaseStatus.NOT_CONFIGURED;
        }
        try (Connection ignored = dataSource.getConnection()) {
            return DatabaseStatus.CONNECTED;
        } catch (SQLException | RuntimeException e) {
            log.warn("Database connection check failed: {}", e.getMessage());
            return DatabaseStatus.CONFIGURED_BUT_UNREACHABLE;
        }
    }
}

package com.ecgheartbeat.backend.config;

import com.ecgheartbeat.backend.storage.DatabaseUrl;
import com.ecgheartbeat.backend.storage.UnconfiguredDataSource;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
@Slf4j
public class DatabaseConfig {

    /**
     * The pool never connects while the context starts; a missing or unreachable store
     * shows up per request instead of failing startup.
     */
    @Bean
    public DataSource dataSource(
            @Value("${ecg.database.url:}") String connectionString,
            @Value("${ecg.database.ssl:false}") boolean ssl,
            @Value("${ecg.database.pool-size:10}") int poolSize,
            @Value("${ecg.database.connection-timeout-ms:5000}") long connectionTimeoutMs
    ) {
        if (connectionString == null || connectionString.isBlank()) {
            log.warn("DATABASE_URL not found; database-backed routes will answer 'Database not configured'");
            return new UnconfiguredDataSource();
        }

        DatabaseUrl databaseUrl;
        try {
            databaseUrl = DatabaseUrl.parse(connectionString, ssl);
        } catch (IllegalArgumentException e) {
            log.error("Failed to create database pool: {}", e.getMessage());
            return new UnconfiguredDataSource();
        }

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("ecg-pool");
        dataSource.setJdbcUrl(databaseUrl.jdbcUrl());
        if (databaseUrl.username() != null) {
            dataSource.setUsername(databaseUrl.username());
        }
        if (databaseUrl.password() != null) {
            dataSource.setPassword(databaseUrl.password());
        }
        dataSource.setMaximumPoolSize(poolSize);
        dataSource.setConnectionTimeout(connectionTimeoutMs);
        dataSource.setInitializationFailTimeout(-1);
        log.info("Database pool created for {}", databaseUrl);
        return dataSource;
    }
}

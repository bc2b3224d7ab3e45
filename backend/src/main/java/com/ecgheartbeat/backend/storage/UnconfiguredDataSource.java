package com.ecgheartbeat.backend.storage;

import org.springframework.jdbc.datasource.AbstractDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Stands in for the pool when no connection string is set, so the application context
 * still starts. Every connection request fails with an {@link SQLException}.
 */
public class UnconfiguredDataSource extends AbstractDataSource {

    @Override
    public Connection getConnection() throws SQLException {
        throw new SQLException("Database not configured");
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return getConnection();
    }
}

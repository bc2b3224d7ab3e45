package com.ecgheartbeat.backend.storage;

import com.ecgheartbeat.backend.exception.StorageUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StorageGatewayTest {

    @Test
    @DisplayName("Without a connection string the store is reported as not configured")
    void notConfigured() {
        StorageGateway gateway = new StorageGateway(new UnconfiguredDataSource(), "");

        assertThat(gateway.isConfigured()).isFalse();
        assertThat(gateway.health()).isEqualTo(DatabaseStatus.NOT_CONFIGURED);
        assertThatThrownBy(gateway::requireConfigured)
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessage("Database not configured");
    }

    @Test
    @DisplayName("A failing connection is reported as configured but not connected")
    void unreachable() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
        StorageGateway gateway = new StorageGateway(dataSource, "postgres://host/db");

        assertThat(gateway.health()).isEqualTo(DatabaseStatus.CONFIGURED_BUT_UNREACHABLE);
        assertThat(gateway.health().getLabel()).isEqualTo("configured but not connected");
    }

    @Test
    @DisplayName("Health check returns the borrowed connection")
    void connectedReleasesConnection() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        StorageGateway gateway = new StorageGateway(dataSource, "postgres://host/db");

        assertThat(gateway.health()).isEqualTo(DatabaseStatus.CONNECTED);
        verify(connection).close();
    }
}

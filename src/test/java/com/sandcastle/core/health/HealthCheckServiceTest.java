package com.sandcastle.core.health;

import com.sandcastle.core.persistence.InMemorySandboxRepository;
import com.sandcastle.core.persistence.SandboxRepository;
import com.sandcastle.sandbox.ContainerRuntime;
import com.sandcastle.sandbox.RuntimeInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static final RuntimeInfo INFO =
            new RuntimeInfo("27.1.1", "1.46", "linux", "x86_64", 8, 16L << 30, 3, 1, 12);

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(2, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("checkAll returns runtime and database components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, null);
        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("runtime", "database"), components);
    }

    @Test
    @DisplayName("Reachable runtime -> UP with version metadata")
    void runtimeReachable() {
        var runtime = mock(ContainerRuntime.class);
        when(runtime.healthCheck()).thenReturn(true);
        when(runtime.getInfo()).thenReturn(INFO);

        var status = new HealthCheckService(runtime, null, null).checkRuntime();

        assertTrue(status.isUp());
        assertEquals("27.1.1", status.metadata().get("version"));
        assertEquals("3", status.metadata().get("containersRunning"));
    }

    @Test
    @DisplayName("Ping fails -> runtime DOWN")
    void runtimeUnreachable() {
        var runtime = mock(ContainerRuntime.class);
        when(runtime.healthCheck()).thenReturn(false);

        var status = new HealthCheckService(runtime, null, null).checkRuntime();

        assertEquals(HealthStatus.Status.DOWN, status.status());
    }

    @Test
    @DisplayName("Ping succeeds but info fails -> runtime DEGRADED")
    void runtimeInfoFails() {
        var runtime = mock(ContainerRuntime.class);
        when(runtime.healthCheck()).thenReturn(true);
        when(runtime.getInfo()).thenThrow(new IllegalStateException("socket closed"));

        var status = new HealthCheckService(runtime, null, null).checkRuntime();

        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertTrue(status.detail().contains("socket closed"));
    }

    @Test
    @DisplayName("In-memory store without DataSource -> database DEGRADED")
    void inMemoryStoreDegraded() {
        SandboxRepository repository = new InMemorySandboxRepository();
        var status = new HealthCheckService(null, repository, null).checkDatabase();
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
    }

    @Test
    @DisplayName("Valid connection -> database UP")
    void databaseUp() throws SQLException {
        var dataSource = mock(DataSource.class);
        var connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(5)).thenReturn(true);

        var status = new HealthCheckService(null, null, dataSource).checkDatabase();

        assertTrue(status.isUp());
    }

    @Test
    @DisplayName("Connection failure -> database DOWN")
    void databaseDown() throws SQLException {
        var dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        var status = new HealthCheckService(null, null, dataSource).checkDatabase();

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("connection refused"));
    }
}

package com.sandcastle.core.health;

import com.sandcastle.core.persistence.InMemorySandboxRepository;
import com.sandcastle.core.persistence.SandboxRepository;
import com.sandcastle.sandbox.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ContainerRuntime containerRuntime;
    private final SandboxRepository repository;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) ContainerRuntime containerRuntime,
            @Autowired(required = false) SandboxRepository repository,
            @Autowired(required = false) DataSource dataSource) {
        this.containerRuntime = containerRuntime;
        this.repository = repository;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRuntime());
        results.add(checkDatabase());
        return results;
    }

    public HealthStatus checkRuntime() {
        if (containerRuntime == null) {
            return HealthStatus.down("runtime", "No ContainerRuntime configured");
        }
        try {
            if (!containerRuntime.healthCheck()) {
                return HealthStatus.down("runtime", "Container runtime not reachable");
            }
            var info = containerRuntime.getInfo();
            var metadata = new LinkedHashMap<String, String>();
            metadata.put("version", String.valueOf(info.version()));
            metadata.put("apiVersion", String.valueOf(info.apiVersion()));
            metadata.put("containersRunning", String.valueOf(info.containersRunning()));
            return HealthStatus.up("runtime", "Container runtime reachable", metadata);
        } catch (Exception e) {
            log.warn("Runtime health check failed: {}", e.getMessage());
            return new HealthStatus("runtime", HealthStatus.Status.DEGRADED,
                    "Runtime answers ping but info failed: " + e.getMessage(), Map.of());
        }
    }

    public HealthStatus checkDatabase() {
        if (dataSource == null) {
            if (repository instanceof InMemorySandboxRepository) {
                return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                        "No database configured; sandboxes are kept in memory", Map.of());
            }
            return HealthStatus.down("database", "No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid", Map.of());
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }
}

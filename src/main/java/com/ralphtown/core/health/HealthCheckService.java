package com.ralphtown.core.health;

import com.ralphtown.core.config.RalphtownProperties;
import com.ralphtown.core.process.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final ProcessSupervisor supervisor;
    private final RalphtownProperties properties;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            ProcessSupervisor supervisor,
            RalphtownProperties properties) {
        this.dataSource = dataSource;
        this.supervisor = supervisor;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkAgent());
        results.add(checkCloneRoot());
        return results;
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    // A missing agent only blocks runs; repos, clones and history still work.
    private HealthStatus checkAgent() {
        String executable = properties.getAgentExecutable();
        return supervisor.resolveExecutable(executable)
                .map(path -> new HealthStatus("agent", HealthStatus.Status.UP,
                        executable + " found", Map.of("path", path.toString())))
                .orElseGet(() -> new HealthStatus("agent", HealthStatus.Status.DEGRADED,
                        executable + " CLI not found in PATH", Map.of()));
    }

    private HealthStatus checkCloneRoot() {
        Path root = properties.getCloneRoot();
        if (Files.isDirectory(root) && !Files.isWritable(root)) {
            return new HealthStatus("clone_root", HealthStatus.Status.DEGRADED,
                    "Clone directory not writable: " + root, Map.of());
        }
        return new HealthStatus("clone_root", HealthStatus.Status.UP,
                "Clones go to " + root, Map.of("path", root.toString()));
    }
}

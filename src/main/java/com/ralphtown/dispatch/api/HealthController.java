package com.ralphtown.dispatch.api;

import com.ralphtown.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for server liveness and component health.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/health: Always "ok" while the server answers; components report
     * database, agent executable and clone root.
     */
    @GetMapping
    public Map<String, Object> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "ok");

        Map<String, Object> components = new LinkedHashMap<>();
        if (healthCheckService != null) {
            for (var check : healthCheckService.checkAll()) {
                Map<String, Object> componentInfo = new LinkedHashMap<>();
                componentInfo.put("status", check.status().name());
                componentInfo.put("detail", check.detail());
                if (check.metadata() != null && !check.metadata().isEmpty()) {
                    componentInfo.put("metadata", check.metadata());
                }
                components.put(check.component(), componentInfo);
            }
        }
        result.put("components", components);
        return result;
    }
}

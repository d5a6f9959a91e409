package com.costtracker.costs.health;

import com.costtracker.costs.config.CostsProperties;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe reporting the configured service name.
 */
@RestController
public class HealthController {

    private final String serviceName;

    public HealthController(CostsProperties properties) {
        this.serviceName = properties.serviceName();
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("service", serviceName, "status", "ok");
    }
}

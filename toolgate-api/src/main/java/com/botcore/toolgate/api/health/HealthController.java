package com.botcore.toolgate.api.health;

import com.botcore.toolgate.application.catalog.ToolCatalog;
import com.botcore.toolgate.application.guard.IncomingAuthGuard;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {

    private final ToolCatalog catalog;
    private final IncomingAuthGuard guard;

    public HealthController(ToolCatalog catalog, IncomingAuthGuard guard) {
        this.catalog = catalog;
        this.guard = guard;
    }

    @GetMapping("/api/v1/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", "toolgate-api",
                "tools", catalog.size(),
                "inboundAuth", guard.isOpen() ? "open" : "enforced",
                "ts", Instant.now().toString()
        );
    }
}

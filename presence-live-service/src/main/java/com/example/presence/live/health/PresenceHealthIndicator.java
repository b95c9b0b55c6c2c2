package com.example.presence.live.health;

import com.example.presence.live.commentary.CommentaryEngineManager;
import com.example.presence.live.registry.ConnectionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports the channel bus as the only hard dependency. Local connection and engine counts are
 * included as details.
 */
@Component
public class PresenceHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry connectionRegistry;
    private final CommentaryEngineManager commentaryEngines;

    public PresenceHealthIndicator(ConnectionRegistry connectionRegistry, CommentaryEngineManager commentaryEngines) {
        this.connectionRegistry = connectionRegistry;
        this.commentaryEngines = commentaryEngines;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean busHealthy = checkBus(details);
        checkConnections(details);

        Health.Builder builder = busHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    private boolean checkBus(Map<String, Object> details) {
        boolean available = connectionRegistry.isBusAvailable();
        details.put("busStatus", available ? "UP" : "DOWN");
        if (!available) {
            details.put("busMode", "local delivery only");
        }
        return available;
    }

    private void checkConnections(Map<String, Object> details) {
        try {
            details.put("connections", connectionRegistry.connectionCount());
            details.put("audiences", connectionRegistry.audienceCount());
            details.put("commentaryEngines", commentaryEngines.activeEngineCount());
        } catch (Exception e) {
            details.put("connectionsError", e.getMessage());
        }
    }
}

package com.example.presence.live.controller;

import com.example.presence.live.commentary.CommentaryEngineManager;
import com.example.presence.live.registry.ConnectionRegistry;
import com.example.presence.live.session.LivePresenceStore;
import com.example.presence.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/presence")
@RequiredArgsConstructor
public class PresenceStatsController {

    private final ConnectionRegistry connectionRegistry;
    private final LivePresenceStore presenceStore;
    private final CommentaryEngineManager commentaryEngines;
    private final AppProperties appProperties;

    /**
     * Counts for this pod only.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("podName", appProperties.getPodName());
        stats.put("clusterName", appProperties.getClusterName());
        stats.put("busAvailable", connectionRegistry.isBusAvailable());
        stats.put("degradedMode", appProperties.getBus().getDegradedMode());
        stats.put("replayBacklog", connectionRegistry.replayBacklog());
        stats.put("connections", connectionRegistry.connectionCount());
        stats.put("audiences", connectionRegistry.audienceCount());
        stats.put("liveEvents", presenceStore.eventCount());
        stats.put("liveRecords", presenceStore.recordCount());
        stats.put("commentaryEngines", commentaryEngines.activeEngineCount());
        return ResponseEntity.ok(stats);
    }
}
